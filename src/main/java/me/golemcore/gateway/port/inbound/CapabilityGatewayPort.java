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
package me.golemcore.gateway.port.inbound;

import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.domain.model.PromptDescriptor;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ResourceDescriptor;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The protocol operations exposed to agents. The caller's identity is passed
 * with every call; implementations hold no per-agent state.
 *
 * <p>
 * Listing operations never fail: internal errors degrade to an empty list and
 * are recorded in the audit log. Forwarding operations complete exceptionally
 * with a {@link me.golemcore.gateway.domain.exception.GatewayException}.
 */
public interface CapabilityGatewayPort {

    CompletableFuture<List<ToolDescriptor>> listTools(CallContext context);

    CompletableFuture<List<ResourceDescriptor>> listResources(CallContext context);

    CompletableFuture<List<PromptDescriptor>> listPrompts(CallContext context);

    CompletableFuture<ToolCallResult> callTool(CallContext context, String name, Map<String, Object> arguments);

    CompletableFuture<ResourceContents> readResource(CallContext context, String uri);

    CompletableFuture<PromptResult> getPrompt(CallContext context, String name, Map<String, String> arguments);

    /**
     * Marks the agent connected to every live server, for transports that keep
     * a connection open.
     */
    CompletableFuture<Void> agentConnected(CallContext context);

    CompletableFuture<Void> agentDisconnected(CallContext context);
}
