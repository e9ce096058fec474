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
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Legacy HTTP+SSE transport. A long-lived GET receives the server's messages as
 * SSE {@code message} events; the first {@code endpoint} event names the URL
 * client messages are POSTed to.
 */
@Slf4j
public class SseMcpTransport implements McpTransport {

    private static final String ENDPOINT_EVENT = "endpoint";
    private static final String MESSAGE_EVENT = "message";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };

    private final String serverName;
    private final WebClient webClient;
    private final String url;
    private final Map<String, String> headers;

    private final CompletableFuture<String> endpoint = new CompletableFuture<>();
    private Disposable subscription;
    private volatile boolean open;

    public SseMcpTransport(String serverName, WebClient webClient, String url, Map<String, String> headers) {
        this.serverName = serverName;
        this.webClient = webClient;
        this.url = url;
        this.headers = Map.copyOf(headers);
    }

    @Override
    public void start(Listener listener, Duration timeout) throws IOException {
        open = true;
        subscription = webClient.get()
                .uri(url)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .headers(h -> headers.forEach(h::set))
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .subscribe(
                        event -> onEvent(event, listener),
                        error -> onStreamEnd(listener, error.getMessage()),
                        () -> onStreamEnd(listener, "event stream completed"));
        try {
            String resolved = endpoint.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Upstream:{}] SSE endpoint announced: {}", serverName, resolved);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new IOException("Interrupted while waiting for SSE endpoint", e);
        } catch (ExecutionException | TimeoutException e) {
            close();
            throw new IOException("No SSE endpoint event from " + url, e);
        }
    }

    private void onEvent(ServerSentEvent<String> event, Listener listener) {
        String type = event.event() != null ? event.event() : MESSAGE_EVENT;
        String data = event.data();
        if (data == null) {
            return;
        }
        if (ENDPOINT_EVENT.equals(type)) {
            endpoint.complete(URI.create(url).resolve(data.trim()).toString());
        } else if (MESSAGE_EVENT.equals(type)) {
            listener.onMessage(data);
        } else {
            log.debug("[Upstream:{}] Ignoring SSE event '{}'", serverName, type);
        }
    }

    private void onStreamEnd(Listener listener, String reason) {
        endpoint.completeExceptionally(new IOException("SSE stream ended: " + reason));
        if (open) {
            open = false;
            listener.onClosed(reason);
        }
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (!open || !endpoint.isDone() || endpoint.isCompletedExceptionally()) {
            return CompletableFuture.failedFuture(new IOException("SSE transport for '" + serverName + "' is not open"));
        }
        return webClient.post()
                .uri(endpoint.join())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(message)
                .retrieve()
                .toBodilessEntity()
                .toFuture()
                .thenApply(response -> null);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
