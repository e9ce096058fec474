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
package me.golemcore.gateway.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.mcp.McpRequestDispatcher;
import me.golemcore.gateway.adapter.inbound.web.security.AgentCredentialsAuthenticationFilter;
import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * JSON-RPC over WebSocket at {@code /ws/mcp}. The agent authenticates on the
 * handshake and stays bound to the connection until it closes; closing cancels
 * its in-flight requests and marks it disconnected from every server.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpWebSocketHandler implements WebSocketHandler {

    private final McpRequestDispatcher dispatcher;
    private final CapabilityGatewayPort gateway;
    private final AgentConnectionRegistry connectionRegistry;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Object attribute = session.getAttributes().get(AgentCredentialsAuthenticationFilter.AGENT_ATTRIBUTE);
        if (!(attribute instanceof AgentIdentity agent)) {
            log.warn("[WebSocket] Connection rejected: no authenticated agent");
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        String connectionId = UUID.randomUUID().toString();
        CallContext connection = CallContext.of(agent, "ws-" + connectionId);
        connectionRegistry.register(connectionId, connection);
        log.info("[WebSocket] Connection established: agent={}, connectionId={}", agent.getDisplayName(),
                connectionId);

        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        Mono<Void> input = Mono.fromFuture(() -> gateway.agentConnected(connection))
                .then(session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .doOnNext(payload -> dispatch(connection, payload, outbound))
                        .then())
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    connectionRegistry.deregister(connectionId);
                    dispatcher.cancelSession(connection);
                    synchronized (outbound) {
                        outbound.tryEmitComplete();
                    }
                    gateway.agentDisconnected(connection).whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            log.warn("[WebSocket] Disconnect bookkeeping failed for {}: {}", connectionId,
                                    Futures.unwrap(ex).getMessage());
                        }
                    });
                });
        Mono<Void> output = session.send(outbound.asFlux().map(session::textMessage));
        return Mono.when(input, output);
    }

    private void dispatch(CallContext connection, String payload, Sinks.Many<String> outbound) {
        dispatcher.handle(connection.withNewCorrelationId(), payload).whenComplete((response, ex) -> {
            if (ex != null) {
                log.warn("[WebSocket] Request failed: {}", Futures.unwrap(ex).getMessage());
                return;
            }
            response.ifPresent(message -> {
                synchronized (outbound) {
                    Sinks.EmitResult result = outbound.tryEmitNext(message);
                    if (result.isFailure()) {
                        log.debug("[WebSocket] Dropped response for closed connection: {}", result);
                    }
                }
            });
        });
    }
}
