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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit record. Appended once, never rewritten.
 */
@Value
@Builder
public class AuditEvent {

    public static final String SOURCE = "gateway";

    Instant timestamp;
    AuditEventType eventType;
    String correlationId;
    String sessionId;
    String agentId;
    @Builder.Default
    String source = SOURCE;
    AuditSeverity severity;
    @Builder.Default
    Map<String, Object> payload = Map.of();
}
