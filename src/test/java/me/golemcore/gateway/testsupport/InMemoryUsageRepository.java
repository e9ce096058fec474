package me.golemcore.gateway.testsupport;

import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.CapabilityUsage;
import me.golemcore.gateway.domain.model.ServerUsage;
import me.golemcore.gateway.port.outbound.UsageRepositoryPort;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemoryUsageRepository implements UsageRepositoryPort {

    private final Map<String, CapabilityUsage> capabilityUsage = new ConcurrentHashMap<>();
    private final Map<String, ServerUsage> serverUsage = new ConcurrentHashMap<>();
    private volatile RuntimeException failure;

    @Override
    public synchronized CompletableFuture<CapabilityUsage> updateCapabilityUsage(String agentId,
            CapabilityKind kind, String capabilityId, UnaryOperator<CapabilityUsage> mutation) {
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        String key = agentId + ":" + kind + ":" + capabilityId;
        CapabilityUsage updated = mutation.apply(capabilityUsage.get(key));
        capabilityUsage.put(key, updated);
        return CompletableFuture.completedFuture(updated);
    }

    @Override
    public synchronized CompletableFuture<ServerUsage> updateServerUsage(String agentId, String serverId,
            UnaryOperator<ServerUsage> mutation) {
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        String key = agentId + ":" + serverId;
        ServerUsage updated = mutation.apply(serverUsage.get(key));
        serverUsage.put(key, updated);
        return CompletableFuture.completedFuture(updated);
    }

    @Override
    public CompletableFuture<Optional<CapabilityUsage>> findCapabilityUsage(String agentId, CapabilityKind kind,
            String capabilityId) {
        return CompletableFuture.completedFuture(
                Optional.ofNullable(capabilityUsage.get(agentId + ":" + kind + ":" + capabilityId)));
    }

    @Override
    public CompletableFuture<Optional<ServerUsage>> findServerUsage(String agentId, String serverId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(serverUsage.get(agentId + ":" + serverId)));
    }

    @Override
    public CompletableFuture<List<ServerUsage>> findServerUsageByAgent(String agentId) {
        return CompletableFuture.completedFuture(serverUsage.values().stream()
                .filter(usage -> agentId.equals(usage.getAgentId()))
                .toList());
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }
}
