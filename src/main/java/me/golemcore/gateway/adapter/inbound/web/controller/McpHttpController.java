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
package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.mcp.McpRequestDispatcher;
import me.golemcore.gateway.adapter.inbound.web.security.AgentCredentialsAuthenticationFilter;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.CallContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * JSON-RPC over HTTP POST. The agent identity is resolved per request by
 * {@link AgentCredentialsAuthenticationFilter}.
 */
@RestController
@RequiredArgsConstructor
public class McpHttpController {

    static final String SESSION_HEADER = "Mcp-Session-Id";

    private final McpRequestDispatcher dispatcher;

    @PostMapping(path = "/mcp", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> handle(@RequestBody String payload,
            @RequestHeader(name = SESSION_HEADER, required = false) String sessionHeader,
            ServerWebExchange exchange) {
        AgentIdentity agent = exchange.getAttribute(AgentCredentialsAuthenticationFilter.AGENT_ATTRIBUTE);
        if (agent == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated"));
        }
        String sessionId = sessionHeader != null && !sessionHeader.isBlank() ? sessionHeader
                : "http-" + UUID.randomUUID();
        CallContext context = CallContext.of(agent, sessionId);
        return Mono.fromFuture(() -> dispatcher.handle(context, payload))
                .map(response -> response
                        .map(body -> ResponseEntity.ok()
                                .header(SESSION_HEADER, sessionId)
                                .contentType(MediaType.APPLICATION_JSON)
                                .body(body))
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED)
                                .header(SESSION_HEADER, sessionId)
                                .<String>build()));
    }
}
