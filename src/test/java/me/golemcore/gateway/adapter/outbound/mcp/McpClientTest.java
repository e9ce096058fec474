package me.golemcore.gateway.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.model.ContentItem;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakeMcpTransport transport;
    private McpClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeMcpTransport()
                .tools("read_file", "write_file")
                .resources("file:///README.md")
                .prompts("summarize");
        client = new McpClient("srv-1", "Files", transport, objectMapper);
    }

    @Test
    void shouldHandshakeThenFetchCatalog() throws Exception {
        client.start(TIMEOUT);

        List<String> methods = transport.sentMethods();
        assertEquals("initialize", methods.get(0));
        assertEquals("notifications/initialized", methods.get(1));
        assertTrue(methods.containsAll(List.of("tools/list", "resources/list", "prompts/list")));

        JsonNode init = transport.sentWithMethod("initialize").get(0).get("params");
        assertEquals("2024-11-05", init.get("protocolVersion").asText());
        assertEquals("golemcore-gateway", init.get("clientInfo").get("name").asText());

        assertEquals(List.of("read_file", "write_file"),
                client.getTools().stream().map(ToolDescriptor::getName).toList());
        assertTrue(client.offersTool("read_file"));
        assertTrue(client.offersResource("file:///README.md"));
        assertTrue(client.offersPrompt("summarize"));
        assertFalse(client.offersTool("summarize"));
        assertTrue(client.isRunning());
    }

    @Test
    void shouldFollowPaginationCursor() throws Exception {
        transport.respond("tools/list", params -> {
            if ("page-2".equals(params.path("cursor").asText(null))) {
                return Map.of("tools", List.of(Map.of("name", "b")));
            }
            return Map.of("tools", List.of(Map.of("name", "a")), "nextCursor", "page-2");
        });

        client.start(TIMEOUT);

        assertEquals(List.of("a", "b"), client.getTools().stream().map(ToolDescriptor::getName).toList());
        assertEquals(2, transport.sentWithMethod("tools/list").size());
    }

    @Test
    void shouldSkipListsTheServerDoesNotAdvertise() throws Exception {
        transport.respond("initialize", params -> Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of("tools", Map.of())));

        client.start(TIMEOUT);

        assertFalse(transport.sentMethods().contains("resources/list"));
        assertFalse(transport.sentMethods().contains("prompts/list"));
        assertTrue(client.getResources().isEmpty());
        assertEquals(2, client.getTools().size());
    }

    @Test
    void shouldTreatUnimplementedListAsEmpty() throws Exception {
        transport.fail("prompts/list", -32601, "Method not found");

        client.start(TIMEOUT);

        assertTrue(client.getPrompts().isEmpty());
        assertEquals(2, client.getTools().size());
    }

    @Test
    void shouldDropEntriesWithoutName() throws Exception {
        transport.respond("tools/list", params -> Map.of("tools",
                List.of(Map.of("name", "ok"), Map.of("description", "nameless"))));

        client.start(TIMEOUT);

        assertEquals(List.of("ok"), client.getTools().stream().map(ToolDescriptor::getName).toList());
    }

    @Test
    void shouldCloseTransportWhenInitializeFails() {
        transport.fail("initialize", -32600, "bad protocol");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> client.start(TIMEOUT));

        assertInstanceOf(McpClient.McpException.class, ex.getCause());
        assertEquals(1, transport.closeCount());
        assertFalse(client.isRunning());
    }

    @Test
    void shouldPropagateTransportStartFailure() {
        transport.failOnStart(new IOException("spawn failed"));

        assertThrows(IOException.class, () -> client.start(TIMEOUT));
        assertFalse(client.isRunning());
    }

    @Test
    void shouldRelayToolResultIncludingErrorFlag() throws Exception {
        transport.respond("tools/call", params -> Map.of(
                "content", List.of(Map.of("type", "text", "text", "echo " + params.get("arguments").get("x"))),
                "isError", true));
        client.start(TIMEOUT);

        ToolCallResult result = client.callTool("read_file", Map.of("x", 1), TIMEOUT).join();

        assertTrue(result.isError());
        assertEquals(List.of(ContentItem.text("echo 1")), result.getContent());
        JsonNode call = transport.sentWithMethod("tools/call").get(0).get("params");
        assertEquals("read_file", call.get("name").asText());
    }

    @Test
    void shouldReadResourceAndGetPrompt() throws Exception {
        transport.respond("resources/read", params -> Map.of("contents",
                List.of(Map.of("uri", params.get("uri").asText(), "mimeType", "text/markdown", "text", "# hi"))));
        transport.respond("prompts/get", params -> Map.of("description", "summary",
                "messages", List.of(Map.of("role", "user",
                        "content", Map.of("type", "text", "text", params.get("arguments").get("topic").asText())))));
        client.start(TIMEOUT);

        ResourceContents contents = client.readResource("file:///README.md", TIMEOUT).join();
        PromptResult prompt = client.getPrompt("summarize", Map.of("topic", "mcp"), TIMEOUT).join();

        assertEquals("# hi", contents.getContents().get(0).getText());
        assertEquals("mcp", prompt.getMessages().get(0).getContent().getText());
    }

    @Test
    void shouldFailWithUpstreamErrorCode() throws Exception {
        transport.fail("tools/call", -32000, "disk full");
        client.start(TIMEOUT);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> client.callTool("write_file", Map.of(), TIMEOUT).join());

        McpClient.McpException cause = assertInstanceOf(McpClient.McpException.class, Futures.unwrap(ex));
        assertEquals(-32000, cause.getCode());
        assertEquals("disk full", cause.getMessage());
    }

    @Test
    void shouldNotifyUpstreamWhenCallIsCancelled() throws Exception {
        transport.hold("tools/call");
        client.start(TIMEOUT);

        CompletableFuture<ToolCallResult> call = client.callTool("read_file", Map.of(), TIMEOUT);
        long requestId = transport.sentWithMethod("tools/call").get(0).get("id").asLong();
        call.cancel(true);

        JsonNode cancelled = transport.awaitSent("notifications/cancelled", TIMEOUT);
        assertEquals(requestId, cancelled.get("params").get("requestId").asLong());
        assertEquals("Request cancelled by client", cancelled.get("params").get("reason").asText());
    }

    @Test
    void shouldTimeOutAndNotifyUpstream() throws Exception {
        transport.hold("tools/call");
        client.start(TIMEOUT);

        CompletableFuture<ToolCallResult> call = client.callTool("read_file", Map.of(), Duration.ofMillis(50));

        CompletionException ex = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(TimeoutException.class, Futures.unwrap(ex));
        JsonNode cancelled = transport.awaitSent("notifications/cancelled", TIMEOUT);
        assertEquals("Request timed out", cancelled.get("params").get("reason").asText());
    }

    @Test
    void shouldFailPendingRequestsWhenSessionEnds() throws Exception {
        transport.hold("tools/call");
        client.start(TIMEOUT);
        CompletableFuture<ToolCallResult> call = client.callTool("read_file", Map.of(), TIMEOUT);

        transport.dropConnection("process exited");

        CompletionException ex = assertThrows(CompletionException.class, call::join);
        assertInstanceOf(IOException.class, Futures.unwrap(ex));
        assertFalse(client.isRunning());
        assertThrows(CompletionException.class, () -> client.callTool("read_file", Map.of(), TIMEOUT).join());
    }

    @Test
    void shouldAnswerServerPingAndRejectOtherServerRequests() throws Exception {
        client.start(TIMEOUT);

        transport.emit("{\"jsonrpc\":\"2.0\",\"id\":\"srv-1\",\"method\":\"ping\"}");
        transport.emit("{\"jsonrpc\":\"2.0\",\"id\":\"srv-2\",\"method\":\"sampling/createMessage\"}");

        JsonNode pong = transport.sentResponseTo("srv-1").orElseThrow();
        assertTrue(pong.get("result").isObject());
        JsonNode rejected = transport.sentResponseTo("srv-2").orElseThrow();
        assertEquals(-32601, rejected.get("error").get("code").asInt());
    }

    @Test
    void shouldRefetchListOnListChangedNotification() throws Exception {
        client.start(TIMEOUT);
        transport.tools("read_file", "write_file", "delete_file");

        transport.emit("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}");

        assertTrue(client.offersTool("delete_file"));
    }

    @Test
    void shouldIgnoreResponsesForUnknownIdsAndGarbage() throws Exception {
        client.start(TIMEOUT);

        transport.emit("{\"jsonrpc\":\"2.0\",\"id\":9999,\"result\":{}}");
        transport.emit("not json");

        assertTrue(client.isRunning());
    }

    @Test
    void shouldHandleBatchedResponses() throws Exception {
        transport.hold("tools/call");
        client.start(TIMEOUT);
        CompletableFuture<ToolCallResult> first = client.callTool("read_file", Map.of(), TIMEOUT);
        CompletableFuture<ToolCallResult> second = client.callTool("write_file", Map.of(), TIMEOUT);
        List<JsonNode> calls = transport.sentWithMethod("tools/call");

        transport.emit("[{\"jsonrpc\":\"2.0\",\"id\":" + calls.get(1).get("id") + ",\"result\":{\"content\":[]}},"
                + "{\"jsonrpc\":\"2.0\",\"id\":" + calls.get(0).get("id") + ",\"result\":{\"content\":[],"
                + "\"isError\":true}}]");

        assertTrue(first.join().isError());
        assertFalse(second.join().isError());
    }
}
