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
package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.AuditEvent;
import me.golemcore.gateway.domain.model.AuditEventType;
import me.golemcore.gateway.domain.model.AuditSeverity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AuditLogPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Builds audit events and appends them to the audit sink. A failing sink is
 * reported in the diagnostic log and never affects the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditLogger {

    private static final String LOG_PREFIX = "[Audit]";

    private final AuditLogPort auditLogPort;
    private final GatewayProperties properties;
    private final Clock clock;

    public void record(CallContext context, AuditEventType type, AuditSeverity severity,
            Map<String, Object> payload) {
        record(context.agentId(), context.sessionId(), context.correlationId(), type, severity, payload);
    }

    public void record(String agentId, String sessionId, String correlationId, AuditEventType type,
            AuditSeverity severity, Map<String, Object> payload) {
        if (!properties.getAudit().isEnabled()) {
            return;
        }
        AuditEvent event = AuditEvent.builder()
                .timestamp(clock.instant())
                .eventType(type)
                .correlationId(correlationId)
                .sessionId(sessionId)
                .agentId(agentId)
                .severity(severity)
                .payload(payload != null ? payload : Map.of())
                .build();
        log.debug("{} {} agent={} correlation={} {}", LOG_PREFIX, type.getWireName(), agentId, correlationId,
                event.getPayload());
        try {
            auditLogPort.append(event).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.error("{} Failed to append {} event {}: {}", LOG_PREFIX, type.getWireName(), correlationId,
                            ex.getMessage());
                }
            });
        } catch (RuntimeException e) { // NOSONAR - audit never fails the audited operation
            log.error("{} Failed to append {} event {}: {}", LOG_PREFIX, type.getWireName(), correlationId,
                    e.getMessage());
        }
    }
}
