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
package me.golemcore.gateway.adapter.outbound.mcp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Streamable HTTP transport: every client message is POSTed to the server URL.
 * The reply is either a JSON body or an SSE stream of messages. The
 * {@code Mcp-Session-Id} header assigned by the server is echoed on every
 * subsequent request and the session is deleted on close.
 */
@Slf4j
public class StreamableHttpMcpTransport implements McpTransport {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };
    private static final Duration DELETE_TIMEOUT = Duration.ofSeconds(5);

    private final String serverName;
    private final WebClient webClient;
    private final String url;
    private final Map<String, String> headers;

    private volatile Listener listener;
    private volatile String sessionId;
    private volatile boolean open;

    public StreamableHttpMcpTransport(String serverName, WebClient webClient, String url,
            Map<String, String> headers) {
        this.serverName = serverName;
        this.webClient = webClient;
        this.url = url;
        this.headers = Map.copyOf(headers);
    }

    @Override
    public void start(Listener listener, Duration timeout) {
        this.listener = listener;
        this.open = true;
        log.info("[Upstream:{}] Using streamable HTTP endpoint {}", serverName, url);
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (!open) {
            return CompletableFuture.failedFuture(new IOException("Transport for '" + serverName + "' is closed"));
        }
        CompletableFuture<Void> delivered = new CompletableFuture<>();
        webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM)
                .headers(h -> {
                    headers.forEach(h::set);
                    String current = sessionId;
                    if (current != null) {
                        h.set(SESSION_HEADER, current);
                    }
                })
                .bodyValue(message)
                .exchangeToFlux(this::readReply)
                .subscribe(
                        payload -> listener.onMessage(payload),
                        delivered::completeExceptionally,
                        () -> delivered.complete(null));
        return delivered;
    }

    private Flux<String> readReply(ClientResponse response) {
        response.headers().header(SESSION_HEADER).stream().findFirst().ifPresent(id -> sessionId = id);
        if (response.statusCode().value() == HttpStatus.ACCEPTED.value()) {
            return response.releaseBody().thenMany(Flux.<String>empty());
        }
        if (response.statusCode().isError()) {
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMapMany(body -> Flux.error(new IOException(
                            "HTTP " + response.statusCode().value() + " from " + url + ": " + body)));
        }
        boolean eventStream = response.headers().contentType()
                .map(MediaType.TEXT_EVENT_STREAM::isCompatibleWith)
                .orElse(false);
        if (eventStream) {
            return response.bodyToFlux(SSE_TYPE)
                    .map(ServerSentEvent::data)
                    .filter(Objects::nonNull);
        }
        return response.bodyToMono(String.class).flux();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        String current = sessionId;
        if (current == null) {
            return;
        }
        try {
            webClient.delete()
                    .uri(url)
                    .header(SESSION_HEADER, current)
                    .retrieve()
                    .toBodilessEntity()
                    .block(DELETE_TIMEOUT);
        } catch (RuntimeException e) { // NOSONAR - servers may not support session deletion
            log.debug("[Upstream:{}] Session delete failed: {}", serverName, e.getMessage());
        }
    }
}
