package me.golemcore.gateway.adapter.inbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.exception.AuthenticationFailureException;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import me.golemcore.gateway.domain.service.AgentAuthService;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StdioGatewayServerTest {

    private static final AgentIdentity AGENT = AgentIdentity.builder().id("agent-1").clientId("client-1").build();

    private final ObjectMapper objectMapper = GatewayConfiguration.objectMapper();
    private GatewayProperties properties;
    private AgentAuthService authService;
    private CapabilityGatewayPort gateway;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        authService = mock(AgentAuthService.class);
        gateway = mock(CapabilityGatewayPort.class);
        output = new ByteArrayOutputStream();
        when(gateway.agentConnected(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(gateway.agentDisconnected(any())).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldServeOneResponsePerRequestLine() throws Exception {
        when(authService.authenticate("client-1", "secret-1")).thenReturn(CompletableFuture.completedFuture(AGENT));
        when(gateway.listTools(any())).thenReturn(CompletableFuture.completedFuture(
                List.of(ToolDescriptor.builder().name("read_file").build())));
        String input = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}\n"
                + "\n"
                + "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}\n";

        boolean served = server(input, Map.of("MCP_CLIENT_ID", "client-1", "API_KEY", "secret-1")).serve();

        assertTrue(served);
        String[] lines = output.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        JsonNode init = objectMapper.readTree(lines[0]);
        JsonNode tools = objectMapper.readTree(lines[1]);
        assertEquals(1, init.get("id").asInt());
        assertEquals("read_file", tools.get("result").get("tools").get(0).get("name").asText());
    }

    @Test
    void shouldMarkAgentConnectedForTheWholeSession() {
        when(authService.authenticate(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(AGENT));

        server("", Map.of("MCP_CLIENT_ID", "client-1", "API_KEY", "secret-1")).serve();

        ArgumentCaptor<CallContext> connected = ArgumentCaptor.forClass(CallContext.class);
        ArgumentCaptor<CallContext> disconnected = ArgumentCaptor.forClass(CallContext.class);
        verify(gateway).agentConnected(connected.capture());
        verify(gateway).agentDisconnected(disconnected.capture());
        assertTrue(connected.getValue().sessionId().startsWith("stdio-"));
        assertEquals(connected.getValue().sessionId(), disconnected.getValue().sessionId());
        assertEquals("agent-1", disconnected.getValue().agentId());
    }

    @Test
    void shouldRefuseToServeWhenAuthenticationFails() {
        when(authService.authenticate(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(
                new AuthenticationFailureException("Invalid client credentials")));

        boolean served = server("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}\n",
                Map.of("MCP_CLIENT_ID", "client-1", "API_KEY", "wrong")).serve();

        assertFalse(served);
        assertEquals("", output.toString(StandardCharsets.UTF_8));
        verify(gateway, never()).agentConnected(any());
    }

    @Test
    void shouldPreferConfiguredCredentialsOverEnvironment() {
        properties.getStdio().setClientId("configured-client");
        properties.getStdio().setClientSecret("configured-secret");
        when(authService.authenticate(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(AGENT));

        server("", Map.of("MCP_CLIENT_ID", "env-client", "API_KEY", "env-secret")).serve();

        verify(authService).authenticate("configured-client", "configured-secret");
    }

    @Test
    void shouldFallBackToClientSecretVariable() {
        when(authService.authenticate(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(AGENT));

        server("", Map.of("MCP_CLIENT_ID", "client-1", "MCP_CLIENT_SECRET", "secret-2")).serve();

        verify(authService).authenticate("client-1", "secret-2");
    }

    private StdioGatewayServer server(String input, Map<String, String> environment) {
        McpRequestDispatcher dispatcher = new McpRequestDispatcher(gateway, objectMapper);
        return new StdioGatewayServer(properties, authService, dispatcher, gateway,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output, environment::get);
    }
}
