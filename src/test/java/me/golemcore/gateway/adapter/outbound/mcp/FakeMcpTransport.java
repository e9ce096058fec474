package me.golemcore.gateway.adapter.outbound.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted capability server. Requests are answered synchronously from inside
 * {@link #send(String)}; methods without a handler get METHOD_NOT_FOUND.
 */
class FakeMcpTransport implements McpTransport {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Function<JsonNode, Object>> handlers = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> errors = new ConcurrentHashMap<>();
    private final Set<String> held = ConcurrentHashMap.newKeySet();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

    private volatile Listener listener;
    private volatile boolean open;
    private volatile IOException startFailure;
    private volatile int closeCount;

    FakeMcpTransport() {
        respond("initialize", params -> Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of("tools", Map.of(), "resources", Map.of(), "prompts", Map.of()),
                "serverInfo", Map.of("name", "fake", "version", "0.1")));
        tools();
        resources();
        prompts();
    }

    FakeMcpTransport tools(String... names) {
        List<Map<String, Object>> tools = java.util.Arrays.stream(names)
                .map(name -> Map.<String, Object>of("name", name, "description", "tool " + name))
                .toList();
        return respond("tools/list", params -> Map.of("tools", tools));
    }

    FakeMcpTransport resources(String... uris) {
        List<Map<String, Object>> resources = java.util.Arrays.stream(uris)
                .map(uri -> Map.<String, Object>of("uri", uri, "name", uri))
                .toList();
        return respond("resources/list", params -> Map.of("resources", resources));
    }

    FakeMcpTransport prompts(String... names) {
        List<Map<String, Object>> prompts = java.util.Arrays.stream(names)
                .map(name -> Map.<String, Object>of("name", name))
                .toList();
        return respond("prompts/list", params -> Map.of("prompts", prompts));
    }

    FakeMcpTransport respond(String method, Function<JsonNode, Object> handler) {
        errors.remove(method);
        held.remove(method);
        handlers.put(method, handler);
        return this;
    }

    FakeMcpTransport fail(String method, int code, String message) {
        handlers.remove(method);
        ObjectNode error = objectMapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        errors.put(method, error);
        return this;
    }

    FakeMcpTransport hold(String method) {
        held.add(method);
        return this;
    }

    FakeMcpTransport failOnStart(IOException failure) {
        this.startFailure = failure;
        return this;
    }

    @Override
    public void start(Listener listener, Duration timeout) throws IOException {
        if (startFailure != null) {
            throw startFailure;
        }
        this.listener = listener;
        this.open = true;
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (!open) {
            return CompletableFuture.failedFuture(new IOException("transport closed"));
        }
        JsonNode node = read(message);
        sent.add(node);
        if (node.hasNonNull("method") && node.hasNonNull("id")) {
            answer(node);
        }
        return CompletableFuture.completedFuture(null);
    }

    private void answer(JsonNode request) {
        String method = request.get("method").asText();
        if (held.contains(method)) {
            return;
        }
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", request.get("id"));
        Function<JsonNode, Object> handler = handlers.get(method);
        if (handler != null) {
            response.set("result", objectMapper.valueToTree(handler.apply(request.path("params"))));
        } else if (errors.containsKey(method)) {
            response.set("error", errors.get(method));
        } else {
            ObjectNode error = response.putObject("error");
            error.put("code", -32601);
            error.put("message", "Method not found: " + method);
        }
        emit(response.toString());
    }

    void emit(String payload) {
        listener.onMessage(payload);
    }

    void dropConnection(String reason) {
        open = false;
        listener.onClosed(reason);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }

    int closeCount() {
        return closeCount;
    }

    List<JsonNode> sent() {
        return List.copyOf(sent);
    }

    List<String> sentMethods() {
        return sent.stream()
                .filter(node -> node.hasNonNull("method"))
                .map(node -> node.get("method").asText())
                .toList();
    }

    List<JsonNode> sentWithMethod(String method) {
        return sent.stream()
                .filter(node -> method.equals(node.path("method").asText(null)))
                .toList();
    }

    Optional<JsonNode> sentResponseTo(String id) {
        return sent.stream()
                .filter(node -> !node.has("method") && id.equals(node.path("id").asText(null)))
                .findFirst();
    }

    JsonNode awaitSent(String method, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            List<JsonNode> matches = sentWithMethod(method);
            if (!matches.isEmpty()) {
                return matches.get(matches.size() - 1);
            }
            Thread.sleep(10);
        }
        throw new AssertionError("No " + method + " sent within " + timeout);
    }

    private JsonNode read(String message) {
        try {
            return objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
