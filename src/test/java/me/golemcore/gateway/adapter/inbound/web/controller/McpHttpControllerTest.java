package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.mcp.McpRequestDispatcher;
import me.golemcore.gateway.adapter.inbound.web.security.AgentCredentialsAuthenticationFilter;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;

class McpHttpControllerTest {

    private static final AgentIdentity AGENT = AgentIdentity.builder().id("agent-1").clientId("client-1").build();

    private CapabilityGatewayPort gateway;
    private McpHttpController controller;

    @BeforeEach
    void setUp() {
        gateway = mock(CapabilityGatewayPort.class);
        controller = new McpHttpController(new McpRequestDispatcher(gateway, GatewayConfiguration.objectMapper()));
    }

    @Test
    void shouldAnswerRequestAndEchoSessionHeader() {
        when(gateway.listTools(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        MockServerWebExchange exchange = authenticatedExchange();

        StepVerifier.create(controller.handle("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}",
                "session-9", exchange))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("session-9", response.getHeaders().getFirst(McpHttpController.SESSION_HEADER));
                    assertTrue(response.getBody().contains("\"result\":{\"tools\":[]}"));
                })
                .verifyComplete();

        ArgumentCaptor<CallContext> context = ArgumentCaptor.forClass(CallContext.class);
        verify(gateway).listTools(context.capture());
        assertEquals("session-9", context.getValue().sessionId());
        assertEquals("agent-1", context.getValue().agentId());
    }

    @Test
    void shouldAcceptNotificationWithoutBody() {
        StepVerifier.create(controller.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
                null, authenticatedExchange()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertNull(response.getBody());
                    assertTrue(response.getHeaders().getFirst(McpHttpController.SESSION_HEADER).startsWith("http-"));
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnauthenticatedExchange() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/mcp").build());

        StepVerifier.create(controller.handle("{}", null, exchange))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.UNAUTHORIZED,
                        ((ResponseStatusException) error).getStatusCode()))
                .verify();
    }

    private static MockServerWebExchange authenticatedExchange() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/mcp").build());
        exchange.getAttributes().put(AgentCredentialsAuthenticationFilter.AGENT_ATTRIBUTE, AGENT);
        return exchange;
    }
}
