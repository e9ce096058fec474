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
package me.golemcore.gateway.adapter.outbound.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.StorageKeys;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.ServerUsage;
import me.golemcore.gateway.port.outbound.StoragePort;
import me.golemcore.gateway.port.outbound.UsageRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Usage counters stored per agent:
 * <ul>
 * <li>{@code usage/<agent>/capabilities/<kind>-<capability>.json}</li>
 * <li>{@code usage/<agent>/servers/<server>.json}</li>
 * </ul>
 *
 * <p>
 * Read-modify-write of one record runs under a lock keyed by its path, so
 * concurrent increments of the same pair are never lost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageUsageRepository implements UsageRepositoryPort {

    private static final String USAGE_DIR = "usage";
    private static final String CAPABILITIES_SEGMENT = "/capabilities/";
    private static final String SERVERS_SEGMENT = "/servers/";
    private static final String JSON_SUFFIX = ".json";
    private static final String LOG_PREFIX = "[Usage]";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final ConcurrentHashMap<String, Object> recordLocks = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<CapabilityUsage> updateCapabilityUsage(String agentId, CapabilityKind kind,
            String capabilityId, UnaryOperator<CapabilityUsage> mutation) {
        String path = capabilityPath(agentId, kind, capabilityId);
        return update(path, CapabilityUsage.class, mutation);
    }

    @Override
    public CompletableFuture<ServerUsage> updateServerUsage(String agentId, String serverId,
            UnaryOperator<ServerUsage> mutation) {
        return update(serverPath(agentId, serverId), ServerUsage.class, mutation);
    }

    @Override
    public CompletableFuture<Optional<CapabilityUsage>> findCapabilityUsage(String agentId, CapabilityKind kind,
            String capabilityId) {
        return storagePort.getText(USAGE_DIR, capabilityPath(agentId, kind, capabilityId))
                .thenApply(json -> Optional.ofNullable(json).map(text -> decode(text, CapabilityUsage.class)));
    }

    @Override
    public CompletableFuture<Optional<ServerUsage>> findServerUsage(String agentId, String serverId) {
        return storagePort.getText(USAGE_DIR, serverPath(agentId, serverId))
                .thenApply(json -> Optional.ofNullable(json).map(text -> decode(text, ServerUsage.class)));
    }

    @Override
    public CompletableFuture<List<ServerUsage>> findServerUsageByAgent(String agentId) {
        String prefix = StorageKeys.fileKey(agentId) + SERVERS_SEGMENT;
        return storagePort.listObjects(USAGE_DIR, prefix)
                .thenCompose(files -> {
                    List<CompletableFuture<String>> reads = files.stream()
                            .filter(file -> file.endsWith(JSON_SUFFIX))
                            .map(file -> storagePort.getText(USAGE_DIR, file))
                            .toList();
                    return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                            .thenApply(ignored -> reads.stream()
                                    .map(CompletableFuture::join)
                                    .filter(Objects::nonNull)
                                    .map(json -> decode(json, ServerUsage.class))
                                    .toList());
                });
    }

    private <T> CompletableFuture<T> update(String path, Class<T> type, UnaryOperator<T> mutation) {
        Object lock = recordLocks.computeIfAbsent(path, key -> new Object());
        return CompletableFuture.supplyAsync(() -> {
            synchronized (lock) {
                String json = storagePort.getText(USAGE_DIR, path).join();
                T current = json != null ? decode(json, type) : null;
                T updated = mutation.apply(current);
                storagePort.putTextAtomic(USAGE_DIR, path, encode(updated), false).join();
                log.trace("{} Updated {}", LOG_PREFIX, path);
                return updated;
            }
        });
    }

    private String capabilityPath(String agentId, CapabilityKind kind, String capabilityId) {
        return StorageKeys.fileKey(agentId) + CAPABILITIES_SEGMENT + kind.getWireName() + "-"
                + StorageKeys.fileKey(capabilityId) + JSON_SUFFIX;
    }

    private String serverPath(String agentId, String serverId) {
        return StorageKeys.fileKey(agentId) + SERVERS_SEGMENT + StorageKeys.fileKey(serverId) + JSON_SUFFIX;
    }

    private <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupted usage record", e);
        }
    }

    private String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize usage record", e);
        }
    }
}
