/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.adapter.outbound.mcp;

import me.golemcore.gateway.domain.exception.CapabilityNotFoundException;
import me.golemcore.gateway.domain.exception.ConfigurationException;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityServer;
import me.golemcore.gateway.domain.model.CatalogEntry;
import me.golemcore.gateway.domain.model.PromptDescriptor;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ResourceDescriptor;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import me.golemcore.gateway.domain.model.UpstreamCatalog;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CapabilityRegistryPort;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Owns one live {@link McpClient} session per registered capability server.
 *
 * <p>
 * This manager provides:
 * <ul>
 * <li>Startup connect of every registered server, each attempt independent
 * <li>Per-server connect/disconnect, serialized per server id
 * <li>Connection counters kept in the registry (incremented once per
 * successful connect, decremented once per teardown of such a session)
 * <li>The merged catalog and routing of forwarded requests to the owning
 * session
 * <li>A periodic sweep reconnecting sessions whose upstream died
 * <li>@PreDestroy shutdown of all sessions
 * </ul>
 *
 * <p>
 * When two servers offer the same tool or prompt name (or resource URI), the
 * session connected first owns it; the duplicate is hidden from the catalog
 * and a warning is logged once.
 *
 * @see McpClient
 */
@Component
@Slf4j
public class UpstreamConnectionManager implements UpstreamPort {

    private static final String LOG_PREFIX = "[UpstreamManager]";
    private static final long SCHEDULER_TERMINATION_SECONDS = 2;

    private final GatewayProperties properties;
    private final CapabilityRegistryPort registry;
    private final McpTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Object> serverLocks = new ConcurrentHashMap<>();
    private final Set<String> reportedDuplicates = ConcurrentHashMap.newKeySet();
    private final AtomicLong connectSequence = new AtomicLong();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "upstream-reconnect");
        t.setDaemon(true);
        return t;
    });

    public UpstreamConnectionManager(GatewayProperties properties, CapabilityRegistryPort registry,
            McpTransportFactory transportFactory, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.registry = registry;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        GatewayProperties.UpstreamProperties upstream = properties.getUpstream();
        if (upstream.isConnectOnStartup()) {
            try {
                int connected = connectAll(registry.listServers().join());
                log.info("{} {} upstream session(s) live after startup", LOG_PREFIX, connected);
            } catch (RuntimeException e) { // NOSONAR - gateway stays up without upstreams
                log.error("{} Failed to load servers from registry: {}", LOG_PREFIX, e.getMessage(), e);
            }
        }
        Duration interval = upstream.getReconnectInterval();
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            scheduler.scheduleWithFixedDelay(this::reconnectSweep, interval.toMillis(), interval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public int connectAll(List<CapabilityServer> servers) {
        int connected = 0;
        for (CapabilityServer server : servers) {
            if (server.getStatus() == null) {
                continue;
            }
            try {
                if (connect(server)) {
                    connected++;
                }
            } catch (RuntimeException e) { // NOSONAR - one server never aborts the others
                log.error("{} Unexpected failure connecting '{}': {}", LOG_PREFIX, server.getId(), e.getMessage(), e);
            }
        }
        return connected;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public boolean connect(CapabilityServer server) {
        synchronized (lockFor(server.getId())) {
            Session existing = sessions.get(server.getId());
            if (existing != null && existing.client().isRunning()) {
                return true;
            }
            if (existing != null) {
                sessions.remove(server.getId());
                teardown(existing);
            }

            McpClient client;
            try {
                client = new McpClient(server.getId(), server.getDisplayName(), transportFactory.create(server),
                        objectMapper);
            } catch (ConfigurationException e) {
                log.error("{} Invalid transport for server '{}': {}", LOG_PREFIX, server.getId(), e.getMessage());
                return false;
            }

            try {
                client.start(properties.getUpstream().getStartupTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("{} Interrupted while connecting '{}'", LOG_PREFIX, server.getId());
                return false;
            } catch (Exception e) { // NOSONAR - any startup failure skips this server only
                log.error("{} Failed to connect server '{}': {}", LOG_PREFIX, server.getId(), e.getMessage());
                client.close();
                return false;
            }

            boolean counted = adjustCounters(server.getId(), true);
            sessions.put(server.getId(), new Session(client, connectSequence.incrementAndGet(), counted));
            log.info("{} Connected server '{}' ({} tools, {} resources, {} prompts)", LOG_PREFIX,
                    server.getDisplayName(), client.getTools().size(), client.getResources().size(),
                    client.getPrompts().size());
            return true;
        }
    }

    @Override
    public void disconnect(String serverId) {
        synchronized (lockFor(serverId)) {
            Session session = sessions.remove(serverId);
            if (session != null) {
                teardown(session);
                log.info("{} Disconnected server '{}'", LOG_PREFIX, serverId);
            }
        }
    }

    @Override
    public void disconnectAll() {
        log.info("{} Disconnecting all upstream sessions", LOG_PREFIX);
        for (String serverId : new ArrayList<>(sessions.keySet())) {
            try {
                disconnect(serverId);
            } catch (RuntimeException e) { // NOSONAR - keep tearing down the rest
                log.warn("{} Error disconnecting '{}': {}", LOG_PREFIX, serverId, e.getMessage());
            }
        }
    }

    @Override
    public UpstreamCatalog catalog() {
        List<McpClient> live = liveClients();
        return new UpstreamCatalog(
                merge(live, CapabilityKind.TOOL, McpClient::getTools, ToolDescriptor::getName),
                merge(live, CapabilityKind.RESOURCE, McpClient::getResources, ResourceDescriptor::getUri),
                merge(live, CapabilityKind.PROMPT, McpClient::getPrompts, PromptDescriptor::getName));
    }

    @Override
    public Set<String> connectedServerIds() {
        return liveClients().stream().map(McpClient::getServerId).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public CompletableFuture<ToolCallResult> forwardCallTool(String serverId, String name,
            Map<String, Object> arguments, Duration timeout) {
        return owner(serverId, client -> client.offersTool(name))
                .map(client -> client.callTool(name, arguments, timeout))
                .orElseGet(() -> CompletableFuture.failedFuture(new CapabilityNotFoundException(
                        "Tool not found on live server '" + serverId + "': " + name)));
    }

    @Override
    public CompletableFuture<ResourceContents> forwardReadResource(String serverId, String uri, Duration timeout) {
        return owner(serverId, client -> client.offersResource(uri))
                .map(client -> client.readResource(uri, timeout))
                .orElseGet(() -> CompletableFuture.failedFuture(new CapabilityNotFoundException(
                        "Resource not found on live server '" + serverId + "': " + uri)));
    }

    @Override
    public CompletableFuture<PromptResult> forwardGetPrompt(String serverId, String name,
            Map<String, String> arguments, Duration timeout) {
        return owner(serverId, client -> client.offersPrompt(name))
                .map(client -> client.getPrompt(name, arguments, timeout))
                .orElseGet(() -> CompletableFuture.failedFuture(new CapabilityNotFoundException(
                        "Prompt not found on live server '" + serverId + "': " + name)));
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(SCHEDULER_TERMINATION_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        disconnectAll();
    }

    void reconnectSweep() {
        List<CapabilityServer> servers;
        try {
            servers = registry.listServers().join();
        } catch (RuntimeException e) { // NOSONAR - retried on the next sweep
            log.warn("{} Reconnect sweep could not read registry: {}", LOG_PREFIX, e.getMessage());
            return;
        }
        Set<String> registered = new HashSet<>();
        for (CapabilityServer server : servers) {
            registered.add(server.getId());
            Session session = sessions.get(server.getId());
            if (session == null || !session.client().isRunning()) {
                log.debug("{} Reconnecting server '{}'", LOG_PREFIX, server.getId());
                connectAll(List.of(server));
            }
        }
        for (String serverId : new ArrayList<>(sessions.keySet())) {
            if (!registered.contains(serverId)) {
                log.info("{} Server '{}' left the registry", LOG_PREFIX, serverId);
                disconnect(serverId);
            }
        }
    }

    private void teardown(Session session) {
        try {
            session.client().close();
        } catch (RuntimeException e) { // NOSONAR - counters are released regardless
            log.warn("{} Error closing session '{}': {}", LOG_PREFIX, session.client().getServerId(),
                    e.getMessage());
        } finally {
            if (session.counted()) {
                adjustCounters(session.client().getServerId(), false);
            }
        }
    }

    private boolean adjustCounters(String serverId, boolean increment) {
        try {
            Optional<CapabilityServer> updated = registry.updateServer(serverId, server -> {
                if (increment) {
                    server.incrementConnection(clock.instant());
                } else {
                    server.decrementConnection(clock.instant());
                }
                return server;
            }).join();
            if (updated.isEmpty()) {
                log.warn("{} Server '{}' is not in the registry, counters not updated", LOG_PREFIX, serverId);
            }
            return updated.isPresent();
        } catch (RuntimeException e) { // NOSONAR - session state wins over counter bookkeeping
            log.error("{} Failed to update counters of '{}': {}", LOG_PREFIX, serverId, e.getMessage());
            return false;
        }
    }

    private Object lockFor(String serverId) {
        return serverLocks.computeIfAbsent(serverId, id -> new Object());
    }

    private List<McpClient> liveClients() {
        return sessions.values().stream()
                .sorted(Comparator.comparingLong(Session::sequence))
                .map(Session::client)
                .filter(McpClient::isRunning)
                .toList();
    }

    private Optional<McpClient> owner(String serverId, Predicate<McpClient> offers) {
        Session session = serverId != null ? sessions.get(serverId) : null;
        if (session == null || !session.client().isRunning()) {
            return Optional.empty();
        }
        return Optional.of(session.client()).filter(offers);
    }

    private <D> List<CatalogEntry<D>> merge(List<McpClient> clients, CapabilityKind kind,
            Function<McpClient, List<D>> descriptors, Function<D, String> key) {
        Map<String, String> owners = new HashMap<>();
        List<CatalogEntry<D>> merged = new ArrayList<>();
        for (McpClient client : clients) {
            for (D descriptor : descriptors.apply(client)) {
                String entryKey = key.apply(descriptor);
                String previous = owners.putIfAbsent(entryKey, client.getServerId());
                if (previous == null) {
                    merged.add(new CatalogEntry<>(client.getServerId(), entryKey, descriptor));
                } else if (reportedDuplicates.add(kind + ":" + entryKey + ":" + client.getServerId())) {
                    log.warn("{} {} '{}' of server '{}' is shadowed by server '{}'", LOG_PREFIX,
                            kind.getWireName(), entryKey, client.getServerId(), previous);
                }
            }
        }
        return merged;
    }

    private record Session(McpClient client, long sequence, boolean counted) {
    }
}
