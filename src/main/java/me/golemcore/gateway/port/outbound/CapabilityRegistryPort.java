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

import me.golemcore.gateway.domain.model.Capability;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityServer;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Read side of the capability server registry, plus the connection counter
 * writes the gateway performs.
 */
public interface CapabilityRegistryPort {

    CompletableFuture<List<CapabilityServer>> listServers();

    CompletableFuture<Optional<CapabilityServer>> findServer(String serverId);

    CompletableFuture<CapabilityServer> saveServer(CapabilityServer server);

    /**
     * Atomically applies {@code mutation} to the stored server. Concurrent
     * updates of the same server are serialized.
     *
     * @return the updated server, or empty if no such server exists
     */
    CompletableFuture<Optional<CapabilityServer>> updateServer(String serverId,
            UnaryOperator<CapabilityServer> mutation);

    CompletableFuture<Capability> saveCapability(Capability capability);

    /**
     * Resolves the given ids of one kind. Ids with no record are absent from
     * the result.
     */
    CompletableFuture<Map<String, Capability>> findCapabilities(CapabilityKind kind, Collection<String> ids);
}
