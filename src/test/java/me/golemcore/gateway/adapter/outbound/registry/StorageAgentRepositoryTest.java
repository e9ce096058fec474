package me.golemcore.gateway.adapter.outbound.registry;

import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageAgentRepositoryTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private StorageAgentRepository repository;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        repository = new StorageAgentRepository(storage, GatewayConfiguration.objectMapper());
    }

    @Test
    void shouldRoundTripAgentById() {
        AgentIdentity agent = agent("agent-1", "client-1");
        repository.save(agent).join();

        AgentIdentity loaded = repository.findById("agent-1").join().orElseThrow();

        assertEquals(agent, loaded);
    }

    @Test
    void shouldResolveByClientId() {
        repository.save(agent("agent-1", "client-1")).join();
        repository.save(agent("agent-2", "client-2")).join();

        assertEquals("agent-2", repository.findByClientId("client-2").join().orElseThrow().getId());
        assertTrue(repository.findByClientId("client-3").join().isEmpty());
    }

    @Test
    void shouldIgnoreStaleClientIndex() {
        repository.save(agent("agent-1", "client-old")).join();
        AgentIdentity rotated = agent("agent-1", "client-new");
        repository.save(rotated).join();

        Optional<AgentIdentity> stale = repository.findByClientId("client-old").join();

        assertTrue(stale.isEmpty());
        assertEquals("agent-1", repository.findByClientId("client-new").join().orElseThrow().getId());
    }

    @Test
    void shouldReturnEmptyForBlankIds() {
        assertTrue(repository.findById("").join().isEmpty());
        assertTrue(repository.findByClientId(null).join().isEmpty());
    }

    @Test
    void shouldStoreClientIdsWithUnsafeCharacters() {
        repository.save(agent("agent-1", "client/with:odd chars")).join();

        assertEquals("agent-1", repository.findByClientId("client/with:odd chars").join().orElseThrow().getId());
    }

    private static AgentIdentity agent(String id, String clientId) {
        return AgentIdentity.builder()
                .id(id)
                .clientId(clientId)
                .clientSecretHash("ab".repeat(32))
                .name("Agent " + id)
                .allowedToolIds(new ArrayList<>(List.of("t-1", "t-2")))
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2026-01-02T00:00:00Z"))
                .build();
    }
}
