package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.PermittedCapability;
import me.golemcore.gateway.domain.model.ServerUsage;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.testsupport.InMemoryUsageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageRecorderTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:30:00Z");
    private static final String AGENT_ID = "agent-1";
    private static final String SERVER_ID = "srv-1";

    private InMemoryUsageRepository repository;
    private GatewayProperties properties;
    private UsageRecorder recorder;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUsageRepository();
        properties = new GatewayProperties();
        recorder = new UsageRecorder(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateRecordsOnFirstUse() {
        recorder.recordUse(AGENT_ID, permitted(CapabilityKind.RESOURCE, "r-1")).join();

        CapabilityUsage usage = repository.findCapabilityUsage(AGENT_ID, CapabilityKind.RESOURCE, "r-1").join()
                .orElseThrow();
        assertEquals(1, usage.getTotalCount());
        assertEquals(NOW, usage.getFirstUsedAt());
        assertEquals(NOW, usage.getLastUsedAt());
        ServerUsage server = repository.findServerUsage(AGENT_ID, SERVER_ID).join().orElseThrow();
        assertEquals(1, server.getTotalResourceReads());
        assertEquals(NOW, server.getLastActivityAt());
    }

    @Test
    void shouldCountEachKindSeparately() {
        recorder.recordUse(AGENT_ID, permitted(CapabilityKind.TOOL, "t-1")).join();
        recorder.recordUse(AGENT_ID, permitted(CapabilityKind.TOOL, "t-2")).join();
        recorder.recordUse(AGENT_ID, permitted(CapabilityKind.PROMPT, "p-1")).join();

        ServerUsage server = repository.findServerUsage(AGENT_ID, SERVER_ID).join().orElseThrow();
        assertEquals(2, server.getTotalToolCalls());
        assertEquals(1, server.getTotalPromptGets());
        assertEquals(0, server.getTotalResourceReads());
    }

    @Test
    void shouldToggleServerConnection() {
        recorder.connect(AGENT_ID, SERVER_ID).join();
        assertTrue(repository.findServerUsage(AGENT_ID, SERVER_ID).join().orElseThrow().isConnected());

        recorder.disconnect(AGENT_ID, SERVER_ID).join();
        ServerUsage usage = repository.findServerUsage(AGENT_ID, SERVER_ID).join().orElseThrow();
        assertFalse(usage.isConnected());
        assertEquals(NOW, usage.getDisconnectedAt());
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getUsage().setEnabled(false);

        recorder.recordUse(AGENT_ID, permitted(CapabilityKind.TOOL, "t-1")).join();
        recorder.connect(AGENT_ID, SERVER_ID).join();

        assertTrue(repository.findServerUsage(AGENT_ID, SERVER_ID).join().isEmpty());
    }

    @Test
    void shouldPropagateStoreFailureToCaller() {
        repository.failWith(new IllegalStateException("down"));

        assertThrows(CompletionException.class,
                () -> recorder.recordUse(AGENT_ID, permitted(CapabilityKind.TOOL, "t-1")).join());
    }

    private static PermittedCapability<Object> permitted(CapabilityKind kind, String capabilityId) {
        return new PermittedCapability<>(capabilityId, SERVER_ID, kind, capabilityId, new Object());
    }
}
