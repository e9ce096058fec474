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
package me.golemcore.gateway.adapter.outbound.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.StorageKeys;
import me.golemcore.gateway.domain.model.Capability;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityServer;
import me.golemcore.gateway.port.outbound.CapabilityRegistryPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Capability servers stored as {@code servers/<id>.json} and capability
 * records as {@code capabilities/<kind>/<id>.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageCapabilityRegistry implements CapabilityRegistryPort {

    private static final String SERVERS_DIR = "servers";
    private static final String CAPABILITIES_DIR = "capabilities";
    private static final String JSON_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, Object> serverLocks = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<List<CapabilityServer>> listServers() {
        return storagePort.listObjects(SERVERS_DIR, "")
                .thenCompose(files -> {
                    List<CompletableFuture<CapabilityServer>> reads = files.stream()
                            .filter(file -> file.endsWith(JSON_SUFFIX) && !file.contains("/"))
                            .map(file -> storagePort.getText(SERVERS_DIR, file).thenApply(this::decodeServerOrNull))
                            .toList();
                    return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                            .thenApply(ignored -> reads.stream()
                                    .map(CompletableFuture::join)
                                    .filter(Objects::nonNull)
                                    .toList());
                });
    }

    @Override
    public CompletableFuture<Optional<CapabilityServer>> findServer(String serverId) {
        return storagePort.getText(SERVERS_DIR, serverFile(serverId))
                .thenApply(json -> Optional.ofNullable(json).map(this::decodeServer));
    }

    @Override
    public CompletableFuture<CapabilityServer> saveServer(CapabilityServer server) {
        return storagePort.putTextAtomic(SERVERS_DIR, serverFile(server.getId()), encode(server), false)
                .thenApply(ignored -> server);
    }

    @Override
    public CompletableFuture<Optional<CapabilityServer>> updateServer(String serverId,
            UnaryOperator<CapabilityServer> mutation) {
        Object lock = serverLocks.computeIfAbsent(serverId, id -> new Object());
        return CompletableFuture.supplyAsync(() -> {
            synchronized (lock) {
                String json = storagePort.getText(SERVERS_DIR, serverFile(serverId)).join();
                if (json == null) {
                    return Optional.<CapabilityServer>empty();
                }
                CapabilityServer updated = mutation.apply(decodeServer(json));
                storagePort.putTextAtomic(SERVERS_DIR, serverFile(serverId), encode(updated), false).join();
                return Optional.of(updated);
            }
        });
    }

    @Override
    public CompletableFuture<Capability> saveCapability(Capability capability) {
        return storagePort.putTextAtomic(CAPABILITIES_DIR, capabilityFile(capability.getKind(), capability.getId()),
                encode(capability), false)
                .thenApply(ignored -> capability);
    }

    @Override
    public CompletableFuture<Map<String, Capability>> findCapabilities(CapabilityKind kind, Collection<String> ids) {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(ids));
        List<CompletableFuture<Capability>> reads = distinct.stream()
                .map(id -> storagePort.getText(CAPABILITIES_DIR, capabilityFile(kind, id))
                        .thenApply(json -> json != null ? decodeCapability(json) : null))
                .toList();
        return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, Capability> found = new LinkedHashMap<>();
                    for (int i = 0; i < distinct.size(); i++) {
                        Capability capability = reads.get(i).join();
                        if (capability != null && capability.getKind() == kind) {
                            found.put(distinct.get(i), capability);
                        }
                    }
                    return found;
                });
    }

    private String serverFile(String serverId) {
        return StorageKeys.fileKey(serverId) + JSON_SUFFIX;
    }

    private String capabilityFile(CapabilityKind kind, String capabilityId) {
        return kind.getWireName() + "/" + StorageKeys.fileKey(capabilityId) + JSON_SUFFIX;
    }

    private CapabilityServer decodeServerOrNull(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CapabilityServer.class);
        } catch (JsonProcessingException e) {
            log.warn("[Registry] Skipping unreadable server record: {}", e.getOriginalMessage());
            return null;
        }
    }

    private CapabilityServer decodeServer(String json) {
        try {
            return objectMapper.readValue(json, CapabilityServer.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupted server record", e);
        }
    }

    private Capability decodeCapability(String json) {
        try {
            return objectMapper.readValue(json, Capability.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupted capability record", e);
        }
    }

    private String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize registry record", e);
        }
    }
}
