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
package me.golemcore.gateway.adapter.inbound.mcp;

import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.exception.GatewayException;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps MCP JSON-RPC methods onto {@link CapabilityGatewayPort}. Shared by the
 * HTTP, WebSocket and stdio transports, which only differ in how they obtain
 * the caller's {@link CallContext}.
 *
 * <p>
 * Supported methods: {@code initialize}, {@code ping}, {@code tools/list},
 * {@code tools/call}, {@code resources/list}, {@code resources/read},
 * {@code resources/templates/list}, {@code prompts/list}, {@code prompts/get},
 * and the notifications {@code notifications/initialized} and
 * {@code notifications/cancelled}.
 *
 * <p>
 * Requests in flight are tracked per agent and session, so a cancel
 * notification or a closing connection cancels the upstream call. Another
 * agent reusing the same session id cannot reach them.
 *
 * <p>
 * Every element of a batch runs under its own correlation id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpRequestDispatcher {

    static final String PROTOCOL_VERSION = "2024-11-05";
    private static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(PROTOCOL_VERSION, "2025-03-26",
            "2025-06-18");
    private static final String SERVER_NAME = "golemcore-gateway";
    private static final String SERVER_VERSION = "1.0.0";
    private static final String LOG_PREFIX = "[Dispatcher]";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final CapabilityGatewayPort gateway;
    private final ObjectMapper objectMapper;

    private final Map<String, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    /**
     * Handles one raw payload: a single message or a batch.
     *
     * @return the serialized response, empty when the payload held only
     *         notifications
     */
    public CompletableFuture<Optional<String>> handle(CallContext context, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("{} Unparseable payload: {}", LOG_PREFIX, e.getOriginalMessage());
            return CompletableFuture.completedFuture(Optional.of(
                    encode(JsonRpcResponse.failure(null, error(JsonRpcError.PARSE_ERROR, "Parse error")))));
        }
        if (root == null || root.isMissingNode()) {
            return CompletableFuture.completedFuture(Optional.of(
                    encode(JsonRpcResponse.failure(null, error(JsonRpcError.INVALID_REQUEST, "Empty request")))));
        }
        if (!root.isArray()) {
            CompletableFuture<Optional<JsonRpcResponse>> single = dispatch(context, root);
            CompletableFuture<Optional<String>> encoded = single.thenApply(response -> response.map(this::encode));
            encoded.whenComplete((value, ex) -> {
                if (encoded.isCancelled()) {
                    single.cancel(true);
                }
            });
            return encoded;
        }

        if (root.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.of(
                    encode(JsonRpcResponse.failure(null, error(JsonRpcError.INVALID_REQUEST, "Empty batch")))));
        }
        List<CompletableFuture<Optional<JsonRpcResponse>>> responses = new ArrayList<>();
        root.forEach(message -> responses.add(dispatch(context.withNewCorrelationId(), message)));
        return CompletableFuture.allOf(responses.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    ArrayNode batch = objectMapper.createArrayNode();
                    responses.forEach(future -> future.join()
                            .ifPresent(response -> batch.add(objectMapper.valueToTree(response))));
                    return batch.isEmpty() ? Optional.<String>empty() : Optional.of(encode(batch));
                });
    }

    /**
     * Dispatches one JSON-RPC message.
     */
    public CompletableFuture<Optional<JsonRpcResponse>> dispatch(CallContext context, JsonNode message) {
        JsonRpcRequest request;
        try {
            request = objectMapper.treeToValue(message, JsonRpcRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.completedFuture(Optional.of(JsonRpcResponse.failure(message.get("id"),
                    error(JsonRpcError.INVALID_REQUEST, "Invalid request"))));
        }
        if (request.getMethod() == null || request.getMethod().isBlank()) {
            return CompletableFuture.completedFuture(Optional.of(JsonRpcResponse.failure(request.getId(),
                    error(JsonRpcError.INVALID_REQUEST, "Missing method"))));
        }
        if (request.isNotification()) {
            handleNotification(context, request);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        CompletableFuture<Object> result;
        try {
            result = invoke(context, request);
        } catch (InvalidParamsException e) {
            return CompletableFuture.completedFuture(Optional.of(
                    JsonRpcResponse.failure(request.getId(), error(JsonRpcError.INVALID_PARAMS, e.getMessage()))));
        }

        String key = inFlightKey(context, request.getId());
        inFlight.put(key, result);
        CompletableFuture<Optional<JsonRpcResponse>> response = result.handle((value, ex) -> {
            inFlight.remove(key, result);
            if (ex == null) {
                return Optional.of(JsonRpcResponse.success(request.getId(), value));
            }
            return Optional.of(JsonRpcResponse.failure(request.getId(), toError(request.getMethod(), ex)));
        });
        response.whenComplete((value, ex) -> {
            if (response.isCancelled()) {
                result.cancel(true);
            }
        });
        return response;
    }

    /**
     * Cancels every request the agent still has running in the session, e.g.
     * because its connection closed.
     */
    public void cancelSession(CallContext session) {
        String prefix = sessionPrefix(session);
        inFlight.forEach((key, future) -> {
            if (key.startsWith(prefix)) {
                future.cancel(true);
            }
        });
    }

    private CompletableFuture<Object> invoke(CallContext context, JsonRpcRequest request) {
        JsonNode params = request.getParams() != null ? request.getParams() : objectMapper.createObjectNode();
        return switch (request.getMethod()) {
        case "initialize" -> CompletableFuture.completedFuture(initializeResult(params));
        case "ping" -> CompletableFuture.completedFuture(Map.of());
        case "tools/list" -> widen(gateway.listTools(context), tools -> Map.of("tools", tools));
        case "resources/list" -> widen(gateway.listResources(context), resources -> Map.of("resources", resources));
        case "resources/templates/list" -> CompletableFuture.completedFuture(Map.of("resourceTemplates", List.of()));
        case "prompts/list" -> widen(gateway.listPrompts(context), prompts -> Map.of("prompts", prompts));
        case "tools/call" -> widen(gateway.callTool(context, requireText(params, "name"), objectArguments(params)),
                result -> result);
        case "resources/read" -> widen(gateway.readResource(context, requireText(params, "uri")), result -> result);
        case "prompts/get" -> widen(gateway.getPrompt(context, requireText(params, "name"), stringArguments(params)),
                result -> result);
        default -> CompletableFuture.failedFuture(new MethodNotFoundException(request.getMethod()));
        };
    }

    private void handleNotification(CallContext context, JsonRpcRequest request) {
        switch (request.getMethod()) {
        case "notifications/initialized" ->
            log.debug("{} Session {} initialized", LOG_PREFIX, context.sessionId());
        case "notifications/cancelled" -> {
            JsonNode requestId = request.getParams() != null ? request.getParams().get("requestId") : null;
            if (requestId != null) {
                CompletableFuture<?> running = inFlight.get(inFlightKey(context, requestId));
                if (running != null) {
                    log.info("{} Agent {} cancelled request {}", LOG_PREFIX, context.agentId(), requestId);
                    running.cancel(true);
                }
            }
        }
        default -> log.debug("{} Ignoring notification {}", LOG_PREFIX, request.getMethod());
        }
    }

    private Map<String, Object> initializeResult(JsonNode params) {
        String requested = params.path("protocolVersion").asText(PROTOCOL_VERSION);
        String version = SUPPORTED_PROTOCOL_VERSIONS.contains(requested) ? requested : PROTOCOL_VERSION;

        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("tools", Map.of("listChanged", false));
        capabilities.put("resources", Map.of("subscribe", false, "listChanged", false));
        capabilities.put("prompts", Map.of("listChanged", false));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", version);
        result.put("capabilities", capabilities);
        result.put("serverInfo", Map.of("name", SERVER_NAME, "version", SERVER_VERSION));
        return result;
    }

    private static <T> CompletableFuture<Object> widen(CompletableFuture<T> future, Function<T, Object> mapper) {
        CompletableFuture<Object> mapped = future.thenApply(mapper);
        mapped.whenComplete((value, ex) -> {
            if (mapped.isCancelled()) {
                future.cancel(true);
            }
        });
        return mapped;
    }

    private static String requireText(JsonNode params, String field) {
        JsonNode value = params.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new InvalidParamsException("Missing required parameter '" + field + "'");
        }
        return value.asText();
    }

    private Map<String, Object> objectArguments(JsonNode params) {
        JsonNode arguments = params.get("arguments");
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (!arguments.isObject()) {
            throw new InvalidParamsException("'arguments' must be an object");
        }
        return objectMapper.convertValue(arguments, MAP_TYPE);
    }

    private static Map<String, String> stringArguments(JsonNode params) {
        JsonNode arguments = params.get("arguments");
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (!arguments.isObject()) {
            throw new InvalidParamsException("'arguments' must be an object");
        }
        Map<String, String> values = new LinkedHashMap<>();
        arguments.fields().forEachRemaining(field -> values.put(field.getKey(),
                field.getValue().isValueNode() ? field.getValue().asText() : field.getValue().toString()));
        return values;
    }

    private JsonRpcError toError(String method, Throwable throwable) {
        Throwable cause = Futures.unwrap(throwable);
        if (cause instanceof GatewayException gatewayException) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("kind", gatewayException.getKind().getWireName());
            return JsonRpcError.builder()
                    .code(gatewayException.getKind().getJsonRpcCode())
                    .message(gatewayException.getMessage())
                    .data(data)
                    .build();
        }
        if (cause instanceof MethodNotFoundException) {
            return error(JsonRpcError.METHOD_NOT_FOUND, cause.getMessage());
        }
        if (cause instanceof CancellationException) {
            return error(JsonRpcError.INTERNAL_ERROR, "Request cancelled");
        }
        log.error("{} Unexpected failure in {}: {}", LOG_PREFIX, method, cause.getMessage(), cause);
        return error(JsonRpcError.INTERNAL_ERROR, "Internal error");
    }

    private static JsonRpcError error(int code, String message) {
        return JsonRpcError.builder().code(code).message(message).build();
    }

    private static String inFlightKey(CallContext context, JsonNode id) {
        return sessionPrefix(context) + id.toString();
    }

    private static String sessionPrefix(CallContext context) {
        return context.agentId() + "#" + context.sessionId() + "#";
    }

    private String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode JSON-RPC response", e);
        }
    }

    private static final class InvalidParamsException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        InvalidParamsException(String message) {
            super(message);
        }
    }

    private static final class MethodNotFoundException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        MethodNotFoundException(String method) {
            super("Method not found: " + method);
        }
    }
}
