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

import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.PermittedCapability;
import me.golemcore.gateway.domain.model.ServerUsage;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.UsageRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Durable per-agent activity counters: one record per (agent, capability) and
 * one per (agent, server). Records are created on first use.
 *
 * <p>
 * Failures propagate to the caller, which treats recording as best-effort.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsageRecorder {

    private final UsageRepositoryPort usageRepository;
    private final GatewayProperties properties;
    private final Clock clock;

    public CompletableFuture<Void> recordUse(String agentId, PermittedCapability<?> capability) {
        if (!properties.getUsage().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        Instant now = clock.instant();
        return usageRepository.updateCapabilityUsage(agentId, capability.kind(), capability.capabilityId(),
                existing -> {
                    CapabilityUsage usage = existing != null ? existing
                            : CapabilityUsage.builder()
                                    .agentId(agentId)
                                    .capabilityId(capability.capabilityId())
                                    .kind(capability.kind())
                                    .serverId(capability.serverId())
                                    .build();
                    usage.recordUse(now);
                    return usage;
                })
                .thenCompose(ignored -> usageRepository.updateServerUsage(agentId, capability.serverId(),
                        existing -> {
                            ServerUsage usage = existing != null ? existing : newServerUsage(agentId,
                                    capability.serverId());
                            usage.recordActivity(capability.kind(), now);
                            return usage;
                        }))
                .thenAccept(usage -> log.trace("[Usage] Recorded {} {} for agent {}", capability.kind(),
                        capability.capabilityId(), agentId));
    }

    public CompletableFuture<Void> connect(String agentId, String serverId) {
        return toggle(agentId, serverId, true);
    }

    public CompletableFuture<Void> disconnect(String agentId, String serverId) {
        return toggle(agentId, serverId, false);
    }

    private CompletableFuture<Void> toggle(String agentId, String serverId, boolean connected) {
        if (!properties.getUsage().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        Instant now = clock.instant();
        return usageRepository.updateServerUsage(agentId, serverId, existing -> {
            ServerUsage usage = existing != null ? existing : newServerUsage(agentId, serverId);
            if (connected) {
                usage.markConnected(now);
            } else {
                usage.markDisconnected(now);
            }
            return usage;
        }).thenAccept(usage -> log.debug("[Usage] Agent {} {} server {}", agentId,
                connected ? "connected to" : "disconnected from", serverId));
    }

    private static ServerUsage newServerUsage(String agentId, String serverId) {
        return ServerUsage.builder().agentId(agentId).serverId(serverId).build();
    }
}
