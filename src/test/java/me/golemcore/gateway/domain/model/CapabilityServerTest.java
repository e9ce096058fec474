package me.golemcore.gateway.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityServerTest {

    private static final Instant T1 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2026-01-01T01:00:00Z");

    @Test
    void shouldActivateOnFirstConnection() {
        CapabilityServer server = CapabilityServer.builder().id("srv").build();
        assertEquals(ServerStatus.REGISTERED, server.getStatus());

        server.incrementConnection(T1);

        assertEquals(ServerStatus.ACTIVE, server.getStatus());
        assertEquals(1, server.getConnectedInstances());
        assertEquals(1, server.getTotalConnections());
        assertEquals(T1, server.getLastConnectedAt());
        assertTrue(server.isConnected());
    }

    @Test
    void shouldReturnToRegisteredWhenLastInstanceLeaves() {
        CapabilityServer server = CapabilityServer.builder().id("srv").build();
        server.incrementConnection(T1);
        server.incrementConnection(T1);

        server.decrementConnection(T2);
        assertEquals(ServerStatus.ACTIVE, server.getStatus());

        server.decrementConnection(T2);
        assertEquals(ServerStatus.REGISTERED, server.getStatus());
        assertEquals(2, server.getTotalConnections());
        assertEquals(T2, server.getLastDisconnectedAt());
    }

    @Test
    void shouldNeverGoBelowZero() {
        CapabilityServer server = CapabilityServer.builder().id("srv").build();

        server.decrementConnection(T1);
        server.decrementConnection(T1);

        assertEquals(0, server.getConnectedInstances());
        assertFalse(server.isConnected());
        assertEquals(ServerStatus.REGISTERED, server.getStatus());
    }

    @Test
    void shouldFallBackToIdForDisplayName() {
        assertEquals("srv", CapabilityServer.builder().id("srv").build().getDisplayName());
        assertEquals("Files", CapabilityServer.builder().id("srv").name("Files").build().getDisplayName());
    }
}
