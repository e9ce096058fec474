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

import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.model.PromptDescriptor;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ResourceDescriptor;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * JSON-RPC 2.0 session with a single capability server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Open the transport
 * <li>Send {@code initialize}, then {@code notifications/initialized}
 * <li>Fetch the catalog ({@code tools/list}, {@code resources/list},
 * {@code prompts/list}), following {@code nextCursor} pages
 * <li>Forward {@code tools/call}, {@code resources/read}, {@code prompts/get}
 * <li>Close the transport
 * </ol>
 *
 * <p>
 * Responses are matched to requests by JSON-RPC id. A {@code list_changed}
 * notification re-fetches that list. A request that is cancelled or times out
 * is reported to the server with {@code notifications/cancelled}.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean: created per server by {@link UpstreamConnectionManager}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String CLIENT_NAME = "golemcore-gateway";
    private static final String CLIENT_VERSION = "1.0.0";
    private static final int METHOD_NOT_FOUND = -32601;
    private static final int MAX_LIST_PAGES = 100;
    private static final String METHOD_INITIALIZE = "initialize";

    private final String serverId;
    private final String serverName;
    private final McpTransport transport;
    private final ObjectMapper objectMapper;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile Duration listTimeout = Duration.ofSeconds(30);
    private volatile JsonNode serverCapabilities;
    private volatile List<ToolDescriptor> tools = List.of();
    private volatile List<ResourceDescriptor> resources = List.of();
    private volatile List<PromptDescriptor> prompts = List.of();

    public McpClient(String serverId, String serverName, McpTransport transport, ObjectMapper objectMapper) {
        this.serverId = serverId;
        this.serverName = serverName;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    /**
     * Open the transport, run the initialize handshake and fetch the catalog.
     * On failure the session is closed before the exception propagates.
     */
    public void start(Duration startupTimeout)
            throws IOException, InterruptedException, ExecutionException, TimeoutException {
        log.info("[Upstream:{}] Connecting", serverName);
        this.listTimeout = startupTimeout;
        running = true;
        try {
            transport.start(new TransportListener(), startupTimeout);

            Map<String, Object> initParams = new LinkedHashMap<>();
            initParams.put("protocolVersion", MCP_PROTOCOL_VERSION);
            initParams.put("capabilities", Map.of());
            initParams.put("clientInfo", Map.of("name", CLIENT_NAME, "version", CLIENT_VERSION));
            JsonNode initResult = sendRequest(METHOD_INITIALIZE, initParams, startupTimeout)
                    .get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
            serverCapabilities = initResult != null ? initResult.get("capabilities") : null;
            log.info("[Upstream:{}] Initialized: {}", serverName,
                    initResult != null ? initResult.path("serverInfo") : "{}");

            sendNotification("notifications/initialized", Map.of());

            CompletableFuture.allOf(refreshTools(), refreshResources(), refreshPrompts())
                    .get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Upstream:{}] Catalog: {} tools, {} resources, {} prompts", serverName,
                    tools.size(), resources.size(), prompts.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Upstream:{}] Initialization interrupted, cleaning up", serverName);
            close();
            throw e;
        } catch (IOException | ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[Upstream:{}] Initialization failed, cleaning up: {}", serverName, e.getMessage());
            close();
            throw e;
        }
    }

    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments, Duration timeout) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return request("tools/call", params, timeout, ToolCallResult.class);
    }

    public CompletableFuture<ResourceContents> readResource(String uri, Duration timeout) {
        return request("resources/read", Map.of("uri", uri), timeout, ResourceContents.class);
    }

    public CompletableFuture<PromptResult> getPrompt(String name, Map<String, String> arguments, Duration timeout) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return request("prompts/get", params, timeout, PromptResult.class);
    }

    CompletableFuture<Void> refreshTools() {
        return fetchList("tools/list", "tools", "tools", ToolDescriptor.class,
                tool -> tool.getName() != null, list -> tools = list);
    }

    CompletableFuture<Void> refreshResources() {
        return fetchList("resources/list", "resources", "resources", ResourceDescriptor.class,
                resource -> resource.getUri() != null, list -> resources = list);
    }

    CompletableFuture<Void> refreshPrompts() {
        return fetchList("prompts/list", "prompts", "prompts", PromptDescriptor.class,
                prompt -> prompt.getName() != null, list -> prompts = list);
    }

    private <T> CompletableFuture<T> request(String method, Map<String, Object> params, Duration timeout,
            Class<T> type) {
        CompletableFuture<JsonNode> raw = sendRequest(method, params, timeout);
        CompletableFuture<T> result = raw.thenApply(node -> convert(node, type, method));
        result.whenComplete((value, ex) -> {
            if (result.isCancelled()) {
                raw.cancel(true);
            }
        });
        return result;
    }

    private <T> T convert(JsonNode node, Class<T> type, String method) {
        if (node == null || node.isNull()) {
            throw new CompletionException(new McpException(-32603, "Empty result for " + method));
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CompletionException(e);
        }
    }

    private <T> CompletableFuture<Void> fetchList(String method, String field, String capability, Class<T> type,
            Predicate<T> valid, Consumer<List<T>> store) {
        if (!advertises(capability)) {
            store.accept(List.of());
            return CompletableFuture.completedFuture(null);
        }
        return fetchPage(method, field, type, valid, null, new ArrayList<>(), 0)
                .handle((items, ex) -> {
                    if (ex == null) {
                        store.accept(List.copyOf(items));
                        return null;
                    }
                    Throwable cause = Futures.unwrap(ex);
                    if (cause instanceof McpException mcpException && mcpException.getCode() == METHOD_NOT_FOUND) {
                        log.debug("[Upstream:{}] {} not implemented", serverName, method);
                        store.accept(List.of());
                    } else {
                        log.warn("[Upstream:{}] {} failed: {}", serverName, method, cause.getMessage());
                    }
                    return null;
                });
    }

    private <T> CompletableFuture<List<T>> fetchPage(String method, String field, Class<T> type, Predicate<T> valid,
            String cursor, List<T> accumulated, int page) {
        Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : Map.of();
        return sendRequest(method, params, listTimeout).thenCompose(result -> {
            if (result == null) {
                return CompletableFuture.completedFuture(accumulated);
            }
            for (JsonNode item : result.path(field)) {
                try {
                    T parsed = objectMapper.treeToValue(item, type);
                    if (valid.test(parsed)) {
                        accumulated.add(parsed);
                    }
                } catch (JsonProcessingException e) {
                    log.warn("[Upstream:{}] Skipping malformed {} entry: {}", serverName, field, e.getOriginalMessage());
                }
            }
            String next = result.path("nextCursor").asText(null);
            if (next == null || next.isEmpty() || page + 1 >= MAX_LIST_PAGES) {
                return CompletableFuture.completedFuture(accumulated);
            }
            return fetchPage(method, field, type, valid, next, accumulated, page + 1);
        });
    }

    private boolean advertises(String capability) {
        JsonNode capabilities = serverCapabilities;
        // servers that omit the capabilities object are probed anyway
        return capabilities == null || !capabilities.isObject() || capabilities.has(capability);
    }

    /**
     * Send a JSON-RPC request. The returned future is the pending request
     * itself: cancelling it, or letting it time out, sends
     * {@code notifications/cancelled} upstream.
     */
    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params, Duration timeout) {
        if (!running) {
            return CompletableFuture.failedFuture(new IOException("Session to '" + serverName + "' is closed"));
        }
        long id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);
        future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((result, ex) -> {
            pendingRequests.remove(id);
            if (METHOD_INITIALIZE.equals(method)) {
                return;
            }
            if (ex instanceof CancellationException) {
                notifyCancelled(id, "Request cancelled by client");
            } else if (ex instanceof TimeoutException) {
                notifyCancelled(id, "Request timed out");
            }
        });

        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.set("params", objectMapper.valueToTree(params));

        String json;
        try {
            json = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            future.completeExceptionally(e);
            return future;
        }
        log.debug("[Upstream:{}] → {}", serverName, json);
        transport.send(json).whenComplete((ignored, ex) -> {
            if (ex != null) {
                future.completeExceptionally(Futures.unwrap(ex));
            }
        });
        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.set("params", objectMapper.valueToTree(params));
        }
        sendRaw(notification, method);
    }

    private void notifyCancelled(long id, String reason) {
        if (!running) {
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("requestId", id);
        params.put("reason", reason);
        sendNotification("notifications/cancelled", params);
    }

    private void sendRaw(JsonNode message, String label) {
        try {
            String json = objectMapper.writeValueAsString(message);
            log.debug("[Upstream:{}] → {}", serverName, json);
            transport.send(json).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.warn("[Upstream:{}] Failed to send {}: {}", serverName, label,
                            Futures.unwrap(ex).getMessage());
                }
            });
        } catch (JsonProcessingException e) {
            log.warn("[Upstream:{}] Failed to encode {}: {}", serverName, label, e.getMessage());
        }
    }

    void handlePayload(String payload) {
        log.debug("[Upstream:{}] ← {}", serverName, payload);
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Upstream:{}] Failed to parse message: {}", serverName, e.getOriginalMessage());
            return;
        }
        if (node.isArray()) {
            node.forEach(this::handleMessage);
        } else {
            handleMessage(node);
        }
    }

    private void handleMessage(JsonNode message) {
        JsonNode idNode = message.get("id");
        boolean hasId = idNode != null && !idNode.isNull();
        String method = message.hasNonNull("method") ? message.get("method").asText() : null;

        if (method != null && hasId) {
            answerServerRequest(idNode, method);
            return;
        }
        if (method != null) {
            handleNotification(method);
            return;
        }

        Long id = hasId ? parseId(idNode) : null;
        CompletableFuture<JsonNode> pending = id != null ? pendingRequests.remove(id) : null;
        if (pending == null) {
            log.warn("[Upstream:{}] Received response for unknown id: {}", serverName, idNode);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.path("code").asInt(-1),
                    error.path("message").asText("Unknown upstream error")));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void handleNotification(String method) {
        switch (method) {
        case "notifications/tools/list_changed" -> refreshTools();
        case "notifications/resources/list_changed" -> refreshResources();
        case "notifications/prompts/list_changed" -> refreshPrompts();
        default -> log.debug("[Upstream:{}] Server notification: {}", serverName, method);
        }
    }

    private void answerServerRequest(JsonNode id, String method) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.set("id", id);
        if ("ping".equals(method)) {
            response.set("result", objectMapper.createObjectNode());
        } else {
            ObjectNode error = response.putObject("error");
            error.put("code", METHOD_NOT_FOUND);
            error.put("message", "Method not supported by gateway: " + method);
        }
        sendRaw(response, "response to " + method);
    }

    private static Long parseId(JsonNode idNode) {
        if (idNode.canConvertToLong()) {
            return idNode.asLong();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    public boolean offersTool(String name) {
        return tools.stream().anyMatch(tool -> tool.getName().equals(name));
    }

    public boolean offersResource(String uri) {
        return resources.stream().anyMatch(resource -> resource.getUri().equals(uri));
    }

    public boolean offersPrompt(String name) {
        return prompts.stream().anyMatch(prompt -> prompt.getName().equals(name));
    }

    public List<ToolDescriptor> getTools() {
        return tools;
    }

    public List<ResourceDescriptor> getResources() {
        return resources;
    }

    public List<PromptDescriptor> getPrompts() {
        return prompts;
    }

    public boolean isRunning() {
        return running && transport.isOpen();
    }

    public String getServerId() {
        return serverId;
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public void close() {
        log.info("[Upstream:{}] Closing session", serverName);
        running = false;
        failPending("Upstream session closing");
        transport.close();
    }

    private final class TransportListener implements McpTransport.Listener {

        @Override
        public void onMessage(String payload) {
            handlePayload(payload);
        }

        @Override
        public void onClosed(String reason) {
            if (running) {
                log.warn("[Upstream:{}] Session ended: {}", serverName, reason);
                running = false;
                failPending("Upstream session closed: " + reason);
            }
        }
    }

    /**
     * JSON-RPC error returned by a capability server.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
