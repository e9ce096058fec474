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
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.port.outbound.AgentRepositoryPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Agent identities stored as {@code agents/<id>.json}, with a client id index
 * under {@code agents/clients/<clientId>.json} pointing at the agent id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageAgentRepository implements AgentRepositoryPort {

    private static final String AGENTS_DIR = "agents";
    private static final String CLIENT_INDEX_DIR = "clients/";
    private static final String AGENT_ID_FIELD = "agentId";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Optional<AgentIdentity>> findById(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return storagePort.getText(AGENTS_DIR, agentFile(agentId))
                .thenApply(json -> Optional.ofNullable(json).map(this::decodeAgent));
    }

    @Override
    public CompletableFuture<Optional<AgentIdentity>> findByClientId(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return storagePort.getText(AGENTS_DIR, indexFile(clientId))
                .thenCompose(json -> {
                    if (json == null) {
                        return CompletableFuture.completedFuture(Optional.<AgentIdentity>empty());
                    }
                    return findById(decodeIndex(json));
                })
                // a stale index entry must never resolve to another agent
                .thenApply(found -> found.filter(agent -> clientId.equals(agent.getClientId())));
    }

    @Override
    public CompletableFuture<AgentIdentity> save(AgentIdentity agent) {
        String agentJson = encode(agent);
        String indexJson = encode(Map.of(AGENT_ID_FIELD, agent.getId()));
        return storagePort.putTextAtomic(AGENTS_DIR, agentFile(agent.getId()), agentJson, false)
                .thenCompose(ignored -> storagePort.putTextAtomic(AGENTS_DIR, indexFile(agent.getClientId()),
                        indexJson, false))
                .thenApply(ignored -> {
                    log.debug("[Registry] Saved agent {} (client {})", agent.getId(), agent.getClientId());
                    return agent;
                });
    }

    private String agentFile(String agentId) {
        return StorageKeys.fileKey(agentId) + ".json";
    }

    private String indexFile(String clientId) {
        return CLIENT_INDEX_DIR + StorageKeys.fileKey(clientId) + ".json";
    }

    private AgentIdentity decodeAgent(String json) {
        try {
            return objectMapper.readValue(json, AgentIdentity.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupted agent record", e);
        }
    }

    private String decodeIndex(String json) {
        try {
            return objectMapper.readTree(json).path(AGENT_ID_FIELD).asText(null);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupted client index record", e);
        }
    }

    private String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize agent record", e);
        }
    }
}
