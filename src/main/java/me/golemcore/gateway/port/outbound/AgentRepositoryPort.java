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

import me.golemcore.gateway.domain.model.AgentIdentity;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Agent identity records of the registry. Every read goes to the durable store;
 * implementations must not cache across calls.
 */
public interface AgentRepositoryPort {

    CompletableFuture<Optional<AgentIdentity>> findById(String agentId);

    CompletableFuture<Optional<AgentIdentity>> findByClientId(String clientId);

    CompletableFuture<AgentIdentity> save(AgentIdentity agent);
}
