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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How the gateway reaches a capability server.
 */
public enum TransportType {

    /**
     * Subprocess speaking JSON-RPC over stdin/stdout.
     */
    @JsonProperty("command")
    COMMAND,

    /**
     * Legacy HTTP+SSE transport: GET an event stream, POST to the announced
     * endpoint.
     */
    @JsonProperty("sse")
    SSE,

    /**
     * Streamable HTTP transport: every JSON-RPC message is a POST.
     */
    @JsonProperty("url")
    STREAMABLE_HTTP
}
