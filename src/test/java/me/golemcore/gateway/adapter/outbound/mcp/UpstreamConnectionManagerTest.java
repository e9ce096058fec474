package me.golemcore.gateway.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.exception.CapabilityNotFoundException;
import me.golemcore.gateway.domain.exception.ConfigurationException;
import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.model.CapabilityServer;
import me.golemcore.gateway.domain.model.CatalogEntry;
import me.golemcore.gateway.domain.model.ServerStatus;
import me.golemcore.gateway.domain.model.ServerTransport;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import me.golemcore.gateway.domain.model.UpstreamCatalog;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.testsupport.InMemoryCapabilityRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UpstreamConnectionManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryCapabilityRegistry registry;
    private McpTransportFactory transportFactory;
    private UpstreamConnectionManager manager;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getUpstream().setStartupTimeout(TIMEOUT);
        registry = new InMemoryCapabilityRegistry();
        transportFactory = mock(McpTransportFactory.class);
        manager = new UpstreamConnectionManager(properties, registry, transportFactory, new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void shouldConnectHealthyServersAndSkipFailingOnes() {
        CapabilityServer healthy = register("healthy");
        CapabilityServer broken = register("broken");
        CapabilityServer misconfigured = register("misconfigured");
        when(transportFactory.create(healthy)).thenReturn(new FakeMcpTransport().tools("echo"));
        when(transportFactory.create(broken))
                .thenReturn(new FakeMcpTransport().failOnStart(new IOException("command not found")));
        when(transportFactory.create(misconfigured)).thenThrow(new ConfigurationException("no command"));

        int connected = manager.connectAll(List.of(healthy, broken, misconfigured));

        assertEquals(1, connected);
        assertEquals(Set.of("healthy"), manager.connectedServerIds());
        assertEquals(1, registry.server("healthy").getConnectedInstances());
        assertEquals(ServerStatus.ACTIVE, registry.server("healthy").getStatus());
        assertEquals(NOW, registry.server("healthy").getLastConnectedAt());
        assertEquals(0, registry.server("broken").getConnectedInstances());
        assertEquals(ServerStatus.REGISTERED, registry.server("misconfigured").getStatus());
    }

    @Test
    void shouldNotReconnectLiveSession() {
        CapabilityServer server = register("srv");
        when(transportFactory.create(server)).thenReturn(new FakeMcpTransport());

        assertTrue(manager.connect(server));
        assertTrue(manager.connect(server));

        assertEquals(1, registry.server("srv").getConnectedInstances());
        assertEquals(1, registry.server("srv").getTotalConnections());
    }

    @Test
    void shouldDecrementCountersOnDisconnectAll() {
        CapabilityServer first = register("first");
        CapabilityServer second = register("second");
        FakeMcpTransport firstTransport = new FakeMcpTransport();
        FakeMcpTransport secondTransport = new FakeMcpTransport();
        when(transportFactory.create(first)).thenReturn(firstTransport);
        when(transportFactory.create(second)).thenReturn(secondTransport);
        manager.connectAll(List.of(first, second));

        manager.disconnectAll();

        assertTrue(manager.connectedServerIds().isEmpty());
        assertEquals(0, registry.server("first").getConnectedInstances());
        assertEquals(ServerStatus.REGISTERED, registry.server("second").getStatus());
        assertEquals(NOW, registry.server("second").getLastDisconnectedAt());
        assertEquals(1, firstTransport.closeCount());
        assertEquals(1, secondTransport.closeCount());
    }

    @Test
    void shouldNotCountServersMissingFromRegistry() {
        CapabilityServer ghost = CapabilityServer.builder().id("ghost")
                .transport(ServerTransport.builder().command("ghost-server").build()).build();
        when(transportFactory.create(ghost)).thenReturn(new FakeMcpTransport());

        assertTrue(manager.connect(ghost));
        manager.disconnect("ghost");

        assertTrue(manager.connectedServerIds().isEmpty());
    }

    @Test
    void shouldLetFirstConnectedServerOwnDuplicateNames() {
        CapabilityServer alpha = register("alpha");
        CapabilityServer beta = register("beta");
        when(transportFactory.create(alpha)).thenReturn(new FakeMcpTransport().tools("search", "alpha_only"));
        when(transportFactory.create(beta)).thenReturn(new FakeMcpTransport().tools("search", "beta_only"));
        manager.connect(alpha);
        manager.connect(beta);

        UpstreamCatalog catalog = manager.catalog();

        List<CatalogEntry<ToolDescriptor>> tools = catalog.tools();
        assertEquals(List.of("search", "alpha_only", "beta_only"), tools.stream().map(CatalogEntry::key).toList());
        assertEquals("alpha", tools.get(0).serverId());
        assertEquals("beta", tools.get(2).serverId());
    }

    @Test
    void shouldRouteForwardedCallToOwningSession() {
        CapabilityServer alpha = register("alpha");
        CapabilityServer beta = register("beta");
        when(transportFactory.create(alpha)).thenReturn(new FakeMcpTransport().tools("a_tool"));
        when(transportFactory.create(beta)).thenReturn(new FakeMcpTransport().tools("b_tool")
                .respond("tools/call", params -> Map.of("content",
                        List.of(Map.of("type", "text", "text", "from beta")))));
        manager.connectAll(List.of(alpha, beta));

        ToolCallResult result = manager.forwardCallTool("beta", "b_tool", Map.of(), TIMEOUT).join();

        assertEquals("from beta", result.getContent().get(0).getText());
    }

    @Test
    void shouldFailForwardWhenNoSessionOffersCapability() {
        CapabilityServer alpha = register("alpha");
        when(transportFactory.create(alpha)).thenReturn(new FakeMcpTransport().tools("a_tool"));
        manager.connect(alpha);

        CompletionException tool = assertThrows(CompletionException.class,
                () -> manager.forwardCallTool("alpha", "missing", Map.of(), TIMEOUT).join());
        CompletionException resource = assertThrows(CompletionException.class,
                () -> manager.forwardReadResource("alpha", "file:///missing", TIMEOUT).join());
        CompletionException prompt = assertThrows(CompletionException.class,
                () -> manager.forwardGetPrompt("alpha", "missing", Map.of(), TIMEOUT).join());

        assertInstanceOf(CapabilityNotFoundException.class, Futures.unwrap(tool));
        assertInstanceOf(CapabilityNotFoundException.class, Futures.unwrap(resource));
        assertInstanceOf(CapabilityNotFoundException.class, Futures.unwrap(prompt));
    }

    @Test
    void shouldNotRerouteForwardToAnotherServerOfferingSameName() {
        CapabilityServer alpha = register("alpha");
        CapabilityServer beta = register("beta");
        FakeMcpTransport alphaTransport = new FakeMcpTransport().tools("search");
        FakeMcpTransport betaTransport = new FakeMcpTransport().tools("search");
        when(transportFactory.create(alpha)).thenReturn(alphaTransport);
        when(transportFactory.create(beta)).thenReturn(betaTransport);
        manager.connect(alpha);
        manager.connect(beta);
        alphaTransport.dropConnection("process exited");

        CompletionException error = assertThrows(CompletionException.class,
                () -> manager.forwardCallTool("alpha", "search", Map.of(), TIMEOUT).join());

        assertInstanceOf(CapabilityNotFoundException.class, Futures.unwrap(error));
        assertTrue(betaTransport.sentWithMethod("tools/call").isEmpty());
    }

    @Test
    void shouldHideDeadSessionsAndReconnectThemOnSweep() {
        CapabilityServer server = register("flaky");
        FakeMcpTransport first = new FakeMcpTransport().tools("echo");
        FakeMcpTransport second = new FakeMcpTransport().tools("echo", "echo2");
        when(transportFactory.create(server)).thenReturn(first, second);
        manager.connect(server);

        first.dropConnection("process exited");

        assertTrue(manager.connectedServerIds().isEmpty());
        assertTrue(manager.catalog().tools().isEmpty());

        manager.reconnectSweep();

        assertEquals(Set.of("flaky"), manager.connectedServerIds());
        assertEquals(2, manager.catalog().tools().size());
        assertEquals(1, registry.server("flaky").getConnectedInstances());
        assertEquals(2, registry.server("flaky").getTotalConnections());
    }

    @Test
    void shouldDropSessionsOfServersThatLeftTheRegistry() {
        CapabilityServer server = register("kept");
        CapabilityServer ghost = CapabilityServer.builder().id("ghost")
                .transport(ServerTransport.builder().command("ghost-server").build()).build();
        FakeMcpTransport ghostTransport = new FakeMcpTransport();
        when(transportFactory.create(server)).thenReturn(new FakeMcpTransport());
        when(transportFactory.create(ghost)).thenReturn(ghostTransport);
        manager.connectAll(List.of(server, ghost));

        manager.reconnectSweep();

        assertEquals(Set.of("kept"), manager.connectedServerIds());
        assertFalse(ghostTransport.isOpen());
    }

    private CapabilityServer register(String id) {
        CapabilityServer server = CapabilityServer.builder()
                .id(id)
                .name(id)
                .transport(ServerTransport.builder().command(id + "-server").build())
                .build();
        registry.saveServer(server).join();
        return server;
    }
}
