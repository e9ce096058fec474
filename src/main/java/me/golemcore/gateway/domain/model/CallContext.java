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
package me.golemcore.gateway.domain.model;

import java.util.UUID;

/**
 * Per-request identity handed to every gateway operation: the authenticated
 * agent plus the session and correlation ids used for audit.
 */
public record CallContext(AgentIdentity agent, String sessionId, String correlationId) {

    public static CallContext of(AgentIdentity agent, String sessionId) {
        return new CallContext(agent, sessionId, UUID.randomUUID().toString());
    }

    public CallContext withNewCorrelationId() {
        return new CallContext(agent, sessionId, UUID.randomUUID().toString());
    }

    public String agentId() {
        return agent.getId();
    }
}
