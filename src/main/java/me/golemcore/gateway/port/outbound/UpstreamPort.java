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

import me.golemcore.gateway.domain.model.CapabilityServer;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.UpstreamCatalog;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Live sessions to the registered capability servers.
 *
 * <p>
 * The session map is read-mostly. Connects and disconnects of the same server
 * are serialized; different servers proceed independently.
 */
public interface UpstreamPort {

    /**
     * Connects every given server. A failure of one server is logged and
     * skipped.
     *
     * @return number of servers connected by this call
     */
    int connectAll(List<CapabilityServer> servers);

    /**
     * Connects one server, replacing a session that is no longer running.
     *
     * @return true if a live session exists for the server afterwards
     */
    boolean connect(CapabilityServer server);

    void disconnect(String serverId);

    /**
     * Tears down every session. Counters of successfully connected servers are
     * decremented even when a teardown fails.
     */
    void disconnectAll();

    /**
     * Merged catalog of every live session, each entry tagged with its server.
     */
    UpstreamCatalog catalog();

    Set<String> connectedServerIds();

    /**
     * Forwards to the session of {@code serverId} only; another server offering
     * the same name is never used.
     *
     * @throws me.golemcore.gateway.domain.exception.CapabilityNotFoundException
     *             (via the future) if that server has no live session offering
     *             the tool
     */
    CompletableFuture<ToolCallResult> forwardCallTool(String serverId, String name, Map<String, Object> arguments,
            Duration timeout);

    CompletableFuture<ResourceContents> forwardReadResource(String serverId, String uri, Duration timeout);

    CompletableFuture<PromptResult> forwardGetPrompt(String serverId, String name, Map<String, String> arguments,
            Duration timeout);
}
