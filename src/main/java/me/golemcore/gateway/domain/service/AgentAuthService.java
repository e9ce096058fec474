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

import me.golemcore.gateway.domain.exception.AuthenticationFailureException;
import me.golemcore.gateway.domain.exception.ValidationException;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.AgentRegistration;
import me.golemcore.gateway.domain.model.AgentRegistrationRequest;
import me.golemcore.gateway.domain.model.AgentUpdate;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.port.outbound.AgentRepositoryPort;
import me.golemcore.gateway.port.outbound.CapabilityRegistryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Agent identities: registration, credential verification and grant updates.
 *
 * <p>
 * Grants must reference existing capability records at the time they are
 * written. They may dangle later; the filter drops such ids silently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentAuthService {

    private final AgentRepositoryPort agentRepository;
    private final CapabilityRegistryPort capabilityRegistry;
    private final SecretHasher secretHasher;
    private final Clock clock;

    /**
     * Creates an agent with a fresh client id and secret. The returned
     * registration holds the only plaintext copy of the secret.
     *
     * @throws ValidationException
     *             (via the future) if a grant names an unknown capability id
     */
    public CompletableFuture<AgentRegistration> register(AgentRegistrationRequest request) {
        Map<CapabilityKind, List<String>> grants = new EnumMap<>(CapabilityKind.class);
        grants.put(CapabilityKind.TOOL, copyOf(request.getToolIds()));
        grants.put(CapabilityKind.RESOURCE, copyOf(request.getResourceIds()));
        grants.put(CapabilityKind.PROMPT, copyOf(request.getPromptIds()));

        return validateGrants(grants).thenCompose(ignored -> {
            String secret = secretHasher.generateSecret();
            Instant now = clock.instant();
            AgentIdentity identity = AgentIdentity.builder()
                    .id(UUID.randomUUID().toString())
                    .clientId(UUID.randomUUID().toString())
                    .clientSecretHash(secretHasher.hash(secret))
                    .name(request.getName())
                    .description(request.getDescription())
                    .allowedToolIds(grants.get(CapabilityKind.TOOL))
                    .allowedResourceIds(grants.get(CapabilityKind.RESOURCE))
                    .allowedPromptIds(grants.get(CapabilityKind.PROMPT))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            return agentRepository.save(identity).thenApply(saved -> {
                log.info("[Auth] Registered agent '{}' with client id {}", saved.getDisplayName(),
                        saved.getClientId());
                return new AgentRegistration(saved, secret);
            });
        });
    }

    /**
     * Verifies a client id / secret pair.
     *
     * @throws AuthenticationFailureException
     *             (via the future) if the client id is unknown or the secret does
     *             not match
     */
    public CompletableFuture<AgentIdentity> authenticate(String clientId, String secret) {
        if (clientId == null || clientId.isBlank() || secret == null || secret.isEmpty()) {
            return CompletableFuture.failedFuture(new AuthenticationFailureException("Missing client credentials"));
        }
        return agentRepository.findByClientId(clientId).thenApply(found -> {
            // hash and compare on both paths
            String storedHash = found.map(AgentIdentity::getClientSecretHash).orElse(SecretHasher.UNMATCHABLE_HASH);
            boolean matches = secretHasher.matches(secret, storedHash);
            if (found.isEmpty() || !matches) {
                log.warn("[Auth] Authentication failed for client id {}", clientId);
                throw new AuthenticationFailureException("Invalid client credentials");
            }
            log.debug("[Auth] Authenticated client id {}", clientId);
            return found.get();
        });
    }

    /**
     * Applies a partial update. A supplied grant list replaces the stored one.
     *
     * @throws ValidationException
     *             (via the future) if the agent does not exist or a grant names
     *             an unknown capability id
     */
    public CompletableFuture<AgentIdentity> update(String agentId, AgentUpdate update) {
        Map<CapabilityKind, List<String>> grants = new EnumMap<>(CapabilityKind.class);
        if (update.getToolIds() != null) {
            grants.put(CapabilityKind.TOOL, copyOf(update.getToolIds()));
        }
        if (update.getResourceIds() != null) {
            grants.put(CapabilityKind.RESOURCE, copyOf(update.getResourceIds()));
        }
        if (update.getPromptIds() != null) {
            grants.put(CapabilityKind.PROMPT, copyOf(update.getPromptIds()));
        }

        return agentRepository.findById(agentId)
                .thenCompose(found -> {
                    AgentIdentity agent = found.orElseThrow(
                            () -> new ValidationException("Unknown agent: " + agentId));
                    return validateGrants(grants).thenApply(ignored -> apply(agent, update, grants));
                })
                .thenCompose(agentRepository::save)
                .thenApply(saved -> {
                    log.info("[Auth] Updated agent {} (grants changed: {})", saved.getId(), !grants.isEmpty());
                    return saved;
                });
    }

    /**
     * Reads the agent from the store. Never served from a cache.
     */
    public CompletableFuture<Optional<AgentIdentity>> get(String agentId) {
        return agentRepository.findById(agentId);
    }

    private AgentIdentity apply(AgentIdentity agent, AgentUpdate update, Map<CapabilityKind, List<String>> grants) {
        if (update.getName() != null) {
            agent.setName(update.getName());
        }
        if (update.getDescription() != null) {
            agent.setDescription(update.getDescription());
        }
        if (grants.containsKey(CapabilityKind.TOOL)) {
            agent.setAllowedToolIds(grants.get(CapabilityKind.TOOL));
        }
        if (grants.containsKey(CapabilityKind.RESOURCE)) {
            agent.setAllowedResourceIds(grants.get(CapabilityKind.RESOURCE));
        }
        if (grants.containsKey(CapabilityKind.PROMPT)) {
            agent.setAllowedPromptIds(grants.get(CapabilityKind.PROMPT));
        }
        agent.setUpdatedAt(clock.instant());
        return agent;
    }

    private CompletableFuture<Void> validateGrants(Map<CapabilityKind, List<String>> grants) {
        Map<CapabilityKind, CompletableFuture<List<String>>> lookups = new EnumMap<>(CapabilityKind.class);
        grants.forEach((kind, ids) -> lookups.put(kind, unknownIds(kind, ids)));

        return CompletableFuture.allOf(lookups.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<String> unknown = new ArrayList<>();
                    List<String> messages = new ArrayList<>();
                    lookups.forEach((kind, lookup) -> {
                        List<String> missing = lookup.join();
                        if (!missing.isEmpty()) {
                            unknown.addAll(missing);
                            messages.add("Unknown " + kind.getWireName() + " IDs: " + String.join(", ", missing));
                        }
                    });
                    if (!unknown.isEmpty()) {
                        throw new ValidationException(String.join("; ", messages), unknown);
                    }
                    return null;
                });
    }

    private CompletableFuture<List<String>> unknownIds(CapabilityKind kind, List<String> ids) {
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return capabilityRegistry.findCapabilities(kind, ids)
                .thenApply(found -> ids.stream().filter(id -> !found.containsKey(id)).distinct().toList());
    }

    private static List<String> copyOf(List<String> ids) {
        return ids != null ? new ArrayList<>(ids) : new ArrayList<>();
    }
}
