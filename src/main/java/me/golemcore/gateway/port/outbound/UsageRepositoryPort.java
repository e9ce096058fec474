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
package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.ServerUsage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Durable usage counters. Both update methods are upsert-or-create: the
 * mutation receives the stored record, or {@code null} when there is none yet,
 * and returns the record to persist. Updates of the same pair are serialized.
 */
public interface UsageRepositoryPort {

    CompletableFuture<CapabilityUsage> updateCapabilityUsage(String agentId, CapabilityKind kind,
            String capabilityId, UnaryOperator<CapabilityUsage> mutation);

    CompletableFuture<ServerUsage> updateServerUsage(String agentId, String serverId,
            UnaryOperator<ServerUsage> mutation);

    CompletableFuture<Optional<CapabilityUsage>> findCapabilityUsage(String agentId, CapabilityKind kind,
            String capabilityId);

    CompletableFuture<Optional<ServerUsage>> findServerUsage(String agentId, String serverId);

    CompletableFuture<List<ServerUsage>> findServerUsageByAgent(String agentId);
}
