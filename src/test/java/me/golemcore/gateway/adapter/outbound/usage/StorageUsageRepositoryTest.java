package me.golemcore.gateway.adapter.outbound.usage;

import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.ServerUsage;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageUsageRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private StorageUsageRepository repository;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        repository = new StorageUsageRepository(storage, GatewayConfiguration.objectMapper());
    }

    @Test
    void shouldCreateAndIncrementCapabilityUsage() {
        for (int i = 0; i < 3; i++) {
            repository.updateCapabilityUsage("agent-1", CapabilityKind.TOOL, "t-1", existing -> {
                CapabilityUsage usage = existing != null ? existing
                        : CapabilityUsage.builder().agentId("agent-1").capabilityId("t-1")
                                .kind(CapabilityKind.TOOL).serverId("srv").build();
                usage.recordUse(NOW);
                return usage;
            }).join();
        }

        CapabilityUsage usage = repository.findCapabilityUsage("agent-1", CapabilityKind.TOOL, "t-1").join()
                .orElseThrow();
        assertEquals(3, usage.getTotalCount());
        assertEquals(NOW, usage.getFirstUsedAt());
        assertTrue(repository.findCapabilityUsage("agent-1", CapabilityKind.PROMPT, "t-1").join().isEmpty());
    }

    @Test
    void shouldNotLoseConcurrentIncrements() {
        List<CompletableFuture<?>> updates = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            updates.add(repository.updateServerUsage("agent-1", "srv", existing -> {
                ServerUsage usage = existing != null ? existing
                        : ServerUsage.builder().agentId("agent-1").serverId("srv").build();
                usage.recordActivity(CapabilityKind.TOOL, NOW);
                return usage;
            }));
        }
        CompletableFuture.allOf(updates.toArray(new CompletableFuture[0])).join();

        assertEquals(25, repository.findServerUsage("agent-1", "srv").join().orElseThrow().getTotalToolCalls());
    }

    @Test
    void shouldListServerUsageOfOneAgent() {
        repository.updateServerUsage("agent-1", "srv-a", existing -> serverUsage("agent-1", "srv-a")).join();
        repository.updateServerUsage("agent-1", "srv-b", existing -> serverUsage("agent-1", "srv-b")).join();
        repository.updateServerUsage("agent-2", "srv-a", existing -> serverUsage("agent-2", "srv-a")).join();

        List<ServerUsage> usage = repository.findServerUsageByAgent("agent-1").join();

        assertEquals(List.of("srv-a", "srv-b"), usage.stream().map(ServerUsage::getServerId).sorted().toList());
    }

    private static ServerUsage serverUsage(String agentId, String serverId) {
        ServerUsage usage = ServerUsage.builder().agentId(agentId).serverId(serverId).build();
        usage.markConnected(NOW);
        return usage;
    }
}
