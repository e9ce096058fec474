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
package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CallContext;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent identity bound to each open WebSocket connection, keyed by connection
 * id. Entries live exactly as long as the connection.
 */
@Component
@Slf4j
public class AgentConnectionRegistry {

    private final Map<String, CallContext> connections = new ConcurrentHashMap<>();

    public void register(String connectionId, CallContext context) {
        connections.put(connectionId, context);
        log.debug("[WebSocket] Registered connection {} for agent {}", connectionId, context.agentId());
    }

    public Optional<CallContext> deregister(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public Optional<CallContext> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int activeConnections() {
        return connections.size();
    }

    public long connectionsOf(String agentId) {
        return connections.values().stream()
                .filter(context -> context.agentId().equals(agentId))
                .count();
    }
}
