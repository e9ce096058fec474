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

import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.Capability;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CatalogEntry;
import me.golemcore.gateway.domain.model.PermittedCapability;
import me.golemcore.gateway.domain.model.PromptDescriptor;
import me.golemcore.gateway.domain.model.ResourceDescriptor;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import me.golemcore.gateway.domain.model.UpstreamCatalog;
import me.golemcore.gateway.port.outbound.CapabilityRegistryPort;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Computes the part of the live upstream catalog an agent may use.
 *
 * <p>
 * Each call re-reads the agent's grants from the store, resolves the granted
 * ids to capability records, and keeps those whose server currently offers a
 * matching entry. Grant ids without a record, or whose capability is not live,
 * are dropped without error. An agent that no longer exists sees nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapabilityFilterService {

    private final AgentAuthService agentAuthService;
    private final CapabilityRegistryPort capabilityRegistry;
    private final UpstreamPort upstreamPort;

    public CompletableFuture<List<PermittedCapability<ToolDescriptor>>> visibleTools(AgentIdentity agent) {
        return visible(agent, CapabilityKind.TOOL, UpstreamCatalog::tools);
    }

    public CompletableFuture<List<PermittedCapability<ResourceDescriptor>>> visibleResources(AgentIdentity agent) {
        return visible(agent, CapabilityKind.RESOURCE, UpstreamCatalog::resources);
    }

    public CompletableFuture<List<PermittedCapability<PromptDescriptor>>> visiblePrompts(AgentIdentity agent) {
        return visible(agent, CapabilityKind.PROMPT, UpstreamCatalog::prompts);
    }

    /**
     * Looks up one capability by lookup key (name, or URI for resources) in the
     * agent's current visible set.
     */
    public CompletableFuture<Optional<PermittedCapability<?>>> findPermitted(AgentIdentity agent,
            CapabilityKind kind, String key) {
        CompletableFuture<? extends List<? extends PermittedCapability<?>>> visible = switch (kind) {
        case TOOL -> visibleTools(agent);
        case RESOURCE -> visibleResources(agent);
        case PROMPT -> visiblePrompts(agent);
        };
        return visible.thenApply(list -> list.stream()
                .filter(permitted -> permitted.key().equals(key))
                .<PermittedCapability<?>>map(permitted -> permitted)
                .findFirst());
    }

    private <D> CompletableFuture<List<PermittedCapability<D>>> visible(AgentIdentity agent, CapabilityKind kind,
            Function<UpstreamCatalog, List<CatalogEntry<D>>> entries) {
        return agentAuthService.get(agent.getId()).thenCompose(current -> {
            if (current.isEmpty()) {
                log.debug("[Filter] Agent {} no longer exists", agent.getId());
                return CompletableFuture.completedFuture(List.<PermittedCapability<D>>of());
            }
            List<String> grants = current.get().grantsFor(kind);
            if (grants.isEmpty()) {
                return CompletableFuture.completedFuture(List.<PermittedCapability<D>>of());
            }
            return capabilityRegistry.findCapabilities(kind, grants)
                    .thenApply(records -> intersect(kind, grants, records,
                            entries.apply(upstreamPort.catalog())));
        });
    }

    private <D> List<PermittedCapability<D>> intersect(CapabilityKind kind, List<String> grants,
            Map<String, Capability> records, List<CatalogEntry<D>> live) {
        Map<String, CatalogEntry<D>> liveByServerAndKey = new HashMap<>();
        for (CatalogEntry<D> entry : live) {
            liveByServerAndKey.put(entry.serverId() + '\u0000' + entry.key(), entry);
        }

        List<PermittedCapability<D>> permitted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String grantId : grants) {
            Capability record = records.get(grantId);
            if (record == null) {
                log.debug("[Filter] Dropping dangling {} grant {}", kind.getWireName(), grantId);
                continue;
            }
            String liveKey = record.getServerId() + '\u0000' + record.getLookupKey();
            CatalogEntry<D> entry = liveByServerAndKey.get(liveKey);
            if (entry != null && seen.add(liveKey)) {
                permitted.add(new PermittedCapability<>(grantId, entry.serverId(), kind, entry.key(),
                        entry.descriptor()));
            }
        }
        return permitted;
    }
}
