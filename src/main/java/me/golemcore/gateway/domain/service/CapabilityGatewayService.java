/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.CapabilityNotFoundException;
import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.exception.GatewayException;
import me.golemcore.gateway.domain.exception.PermissionDeniedException;
import me.golemcore.gateway.domain.exception.PermissionRevokedException;
import me.golemcore.gateway.domain.exception.UpstreamExecutionException;
import me.golemcore.gateway.domain.exception.UpstreamTimeoutException;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.AuditEventType;
import me.golemcore.gateway.domain.model.AuditSeverity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.domain.model.CapabilityKind;
import me.golemcore.gateway.domain.model.ContentItem;
import me.golemcore.gateway.domain.model.ListingOutcome;
import me.golemcore.gateway.domain.model.PermittedCapability;
import me.golemcore.gateway.domain.model.PromptDescriptor;
import me.golemcore.gateway.domain.model.PromptResult;
import me.golemcore.gateway.domain.model.ResourceContent;
import me.golemcore.gateway.domain.model.ResourceContents;
import me.golemcore.gateway.domain.model.ResourceDescriptor;
import me.golemcore.gateway.domain.model.ToolCallResult;
import me.golemcore.gateway.domain.model.ToolDescriptor;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The gateway's protocol operations.
 *
 * <p>
 * Listing returns the agent's visible subset of the live catalog and never
 * fails; an internal error yields an empty list plus a {@code list_error}
 * audit event.
 *
 * <p>
 * Forwarding (call/read/get) runs one pipeline for every kind:
 * <ol>
 * <li>audit the attempt
 * <li>check the fresh grant; fail with {@link PermissionDeniedException}
 * <li>re-check immediately before dispatch; fail with
 * {@link PermissionRevokedException}
 * <li>forward under the configured call timeout
 * <li>record usage (best-effort) and audit the result
 * </ol>
 * Cancelling the returned future cancels the upstream request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapabilityGatewayService implements CapabilityGatewayPort {

    private static final String LOG_PREFIX = "[Gateway]";
    private static final String BINARY_MARKER = "[binary content omitted]";
    private static final String TRUNCATION_SUFFIX = "...";

    private final CapabilityFilterService filterService;
    private final UpstreamPort upstreamPort;
    private final UsageRecorder usageRecorder;
    private final AuditLogger auditLogger;
    private final GatewayProperties properties;

    // ===== Listing =====

    @Override
    public CompletableFuture<List<ToolDescriptor>> listTools(CallContext context) {
        return listOutcome(context, CapabilityKind.TOOL, filterService::visibleTools)
                .thenApply(ListingOutcome::items);
    }

    @Override
    public CompletableFuture<List<ResourceDescriptor>> listResources(CallContext context) {
        return listOutcome(context, CapabilityKind.RESOURCE, filterService::visibleResources)
                .thenApply(ListingOutcome::items);
    }

    @Override
    public CompletableFuture<List<PromptDescriptor>> listPrompts(CallContext context) {
        return listOutcome(context, CapabilityKind.PROMPT, filterService::visiblePrompts)
                .thenApply(ListingOutcome::items);
    }

    <D> CompletableFuture<ListingOutcome<D>> listOutcome(CallContext context, CapabilityKind kind,
            Function<AgentIdentity, CompletableFuture<List<PermittedCapability<D>>>> visible) {
        CompletableFuture<List<PermittedCapability<D>>> pipeline;
        try {
            pipeline = visible.apply(context.agent());
        } catch (RuntimeException e) { // NOSONAR - listing degrades to empty
            pipeline = CompletableFuture.failedFuture(e);
        }
        Duration timeout = properties.getUpstream().getListTimeout();
        return pipeline
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((permitted, ex) -> {
                    if (ex == null) {
                        return ListingOutcome.success(permitted.stream().map(PermittedCapability::descriptor).toList());
                    }
                    Throwable cause = Futures.unwrap(ex);
                    String reason = describe(cause);
                    log.error("{} Listing {}s failed for agent {}: {}", LOG_PREFIX, kind.getWireName(),
                            context.agentId(), reason);
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("kind", kind.getWireName());
                    payload.put("error", reason);
                    auditLogger.record(context, AuditEventType.LIST_ERROR, AuditSeverity.ERROR, payload);
                    return ListingOutcome.<D>failure(reason);
                });
    }

    // ===== Forwarding =====

    @Override
    public CompletableFuture<ToolCallResult> callTool(CallContext context, String name,
            Map<String, Object> arguments) {
        Map<String, Object> attempt = new LinkedHashMap<>();
        attempt.put("tool", name);
        attempt.put("argumentNames", arguments != null ? new ArrayList<>(arguments.keySet()) : List.of());
        return checkThenDispatch(context, CapabilityKind.TOOL, name, attempt,
                (capability, timeout) -> upstreamPort.forwardCallTool(capability.serverId(), name, arguments, timeout),
                this::summarizeToolResult);
    }

    @Override
    public CompletableFuture<ResourceContents> readResource(CallContext context, String uri) {
        Map<String, Object> attempt = new LinkedHashMap<>();
        attempt.put("uri", uri);
        return checkThenDispatch(context, CapabilityKind.RESOURCE, uri, attempt,
                (capability, timeout) -> upstreamPort.forwardReadResource(capability.serverId(), uri, timeout),
                this::summarizeResourceResult);
    }

    @Override
    public CompletableFuture<PromptResult> getPrompt(CallContext context, String name,
            Map<String, String> arguments) {
        Map<String, Object> attempt = new LinkedHashMap<>();
        attempt.put("prompt", name);
        attempt.put("argumentNames", arguments != null ? new ArrayList<>(arguments.keySet()) : List.of());
        return checkThenDispatch(context, CapabilityKind.PROMPT, name, attempt,
                (capability, timeout) -> upstreamPort.forwardGetPrompt(capability.serverId(), name, arguments, timeout),
                this::summarizePromptResult);
    }

    private <R> CompletableFuture<R> checkThenDispatch(CallContext context, CapabilityKind kind, String key,
            Map<String, Object> attempt, BiFunction<PermittedCapability<?>, Duration, CompletableFuture<R>> dispatch,
            Function<R, Map<String, Object>> summarize) {
        Duration timeout = properties.getUpstream().getCallTimeout();
        auditLogger.record(context, AuditEventType.attemptOf(kind), AuditSeverity.INFO, attempt);

        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<R>> upstreamCall = new AtomicReference<>();
        AtomicReference<PermittedCapability<?>> granted = new AtomicReference<>();

        checkPermission(context, kind, key)
                .thenCompose(first -> {
                    if (first.isEmpty()) {
                        auditLogger.record(context, AuditEventType.ACCESS_DENIED, AuditSeverity.WARNING,
                                subject(kind, key));
                        throw new PermissionDeniedException(kind, key);
                    }
                    return checkPermission(context, kind, key);
                })
                .thenCompose(second -> {
                    if (second.isEmpty()) {
                        auditLogger.record(context, AuditEventType.ACCESS_REVOKED, AuditSeverity.WARNING,
                                subject(kind, key));
                        throw new PermissionRevokedException(kind, key);
                    }
                    if (result.isDone()) {
                        throw new CancellationException("Caller went away before dispatch");
                    }
                    granted.set(second.get());
                    CompletableFuture<R> call = dispatch.apply(second.get(), timeout);
                    upstreamCall.set(call);
                    return call;
                })
                .whenComplete((value, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(
                                classify(context, kind, key, Futures.unwrap(ex), timeout, upstreamCall.get() != null));
                        return;
                    }
                    recordUsage(context, granted.get()).whenComplete((ignored, usageEx) -> {
                        try {
                            auditLogger.record(context, AuditEventType.resultOf(kind), AuditSeverity.INFO,
                                    summarizeSafely(kind, key, value, summarize, granted.get()));
                        } finally {
                            result.complete(value);
                        }
                    });
                });

        result.whenComplete((value, ex) -> {
            if (result.isCancelled()) {
                CompletableFuture<R> call = upstreamCall.get();
                if (call != null) {
                    log.info("{} Cancelling upstream {} '{}' for agent {}", LOG_PREFIX, kind.getWireName(), key,
                            context.agentId());
                    call.cancel(true);
                }
            }
        });
        return result;
    }

    private CompletableFuture<Optional<PermittedCapability<?>>> checkPermission(CallContext context,
            CapabilityKind kind, String key) {
        return filterService.findPermitted(context.agent(), kind, key);
    }

    private Throwable classify(CallContext context, CapabilityKind kind, String key, Throwable cause,
            Duration timeout, boolean dispatched) {
        if (cause instanceof PermissionDeniedException || cause instanceof PermissionRevokedException
                || cause instanceof CancellationException) {
            return cause;
        }
        Map<String, Object> payload = subject(kind, key);
        AuditEventType errorType = AuditEventType.errorOf(kind);

        if (cause instanceof TimeoutException) {
            payload.put("error", "timeout");
            payload.put("timeoutMs", timeout.toMillis());
            log.error("{} Upstream {} '{}' timed out after {}", LOG_PREFIX, kind.getWireName(), key, timeout);
            auditLogger.record(context, errorType, AuditSeverity.ERROR, payload);
            return new UpstreamTimeoutException(operationName(kind, key), timeout);
        }
        if (cause instanceof CapabilityNotFoundException) {
            payload.put("error", cause.getMessage());
            auditLogger.record(context, errorType, AuditSeverity.WARNING, payload);
            return cause;
        }
        if (cause instanceof GatewayException) {
            payload.put("error", cause.getMessage());
            auditLogger.record(context, errorType, AuditSeverity.ERROR, payload);
            return cause;
        }

        payload.put("error", describe(cause));
        auditLogger.record(context, errorType, AuditSeverity.ERROR, payload);
        if (!dispatched) {
            log.error("{} Permission check for {} '{}' failed: {}", LOG_PREFIX, kind.getWireName(), key,
                    describe(cause), cause);
            return cause;
        }
        log.warn("{} Upstream {} '{}' failed: {}", LOG_PREFIX, kind.getWireName(), key, describe(cause));
        return new UpstreamExecutionException(operationName(kind, key) + " failed: " + describe(cause), cause);
    }

    private CompletableFuture<Void> recordUsage(CallContext context, PermittedCapability<?> capability) {
        CompletableFuture<Void> recording;
        try {
            recording = usageRecorder.recordUse(context.agentId(), capability);
        } catch (RuntimeException e) { // NOSONAR - usage is best-effort
            recording = CompletableFuture.failedFuture(e);
        }
        return recording.exceptionally(ex -> {
            log.warn("{} Failed to record usage of {} for agent {}: {}", LOG_PREFIX, capability.capabilityId(),
                    context.agentId(), Futures.unwrap(ex).getMessage());
            return null;
        });
    }

    // ===== Connection tracking =====

    @Override
    public CompletableFuture<Void> agentConnected(CallContext context) {
        return trackConnection(context, true);
    }

    @Override
    public CompletableFuture<Void> agentDisconnected(CallContext context) {
        return trackConnection(context, false);
    }

    private CompletableFuture<Void> trackConnection(CallContext context, boolean connected) {
        Set<String> servers = upstreamPort.connectedServerIds();
        List<CompletableFuture<Void>> updates = new ArrayList<>();
        for (String serverId : servers) {
            Supplier<CompletableFuture<Void>> update = connected
                    ? () -> usageRecorder.connect(context.agentId(), serverId)
                    : () -> usageRecorder.disconnect(context.agentId(), serverId);
            updates.add(bestEffort(update, serverId));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("servers", servers.stream().sorted().toList());
        auditLogger.record(context,
                connected ? AuditEventType.AGENT_CONNECTED : AuditEventType.AGENT_DISCONNECTED,
                AuditSeverity.INFO, payload);
        return CompletableFuture.allOf(updates.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> bestEffort(Supplier<CompletableFuture<Void>> update, String serverId) {
        CompletableFuture<Void> future;
        try {
            future = update.get();
        } catch (RuntimeException e) { // NOSONAR - usage is best-effort
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(ex -> {
            log.warn("{} Failed to update connection state for server {}: {}", LOG_PREFIX, serverId,
                    Futures.unwrap(ex).getMessage());
            return null;
        });
    }

    // ===== Audit payloads =====

    private <R> Map<String, Object> summarizeSafely(CapabilityKind kind, String key, R value,
            Function<R, Map<String, Object>> summarize, PermittedCapability<?> capability) {
        Map<String, Object> payload = subject(kind, key);
        if (capability != null) {
            payload.put("capabilityId", capability.capabilityId());
            payload.put("serverId", capability.serverId());
        }
        if (value != null) {
            try {
                payload.putAll(summarize.apply(value));
            } catch (RuntimeException e) { // NOSONAR - the subject alone is still audited
                log.warn("{} Could not summarize {} '{}' result: {}", LOG_PREFIX, kind.getWireName(), key,
                        describe(e));
            }
        }
        return payload;
    }

    private Map<String, Object> summarizeToolResult(ToolCallResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        List<ContentItem> content = result.getContent() != null ? result.getContent() : List.of();
        summary.put("isError", result.isError());
        summary.put("contentItems", content.size());
        if (!content.isEmpty()) {
            summary.put("preview", preview(content.get(0)));
        }
        return summary;
    }

    private Map<String, Object> summarizeResourceResult(ResourceContents result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        List<ResourceContent> contents = result.getContents() != null ? result.getContents() : List.of();
        summary.put("contents", contents.size());
        summary.put("mimeTypes", contents.stream()
                .filter(Objects::nonNull)
                .map(ResourceContent::getMimeType)
                .filter(Objects::nonNull)
                .distinct()
                .toList());
        return summary;
    }

    private Map<String, Object> summarizePromptResult(PromptResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("messages", result.getMessages() != null ? result.getMessages().size() : 0);
        return summary;
    }

    /**
     * Text capped to the configured preview length; anything else is reduced
     * to a marker so raw bytes never reach the audit log.
     */
    String preview(ContentItem item) {
        if (item == null) {
            return BINARY_MARKER;
        }
        if (item.isText() && item.getText() != null) {
            int limit = properties.getAudit().getPreviewChars();
            String text = item.getText();
            return text.length() <= limit ? text : text.substring(0, limit) + TRUNCATION_SUFFIX;
        }
        if (ContentItem.TYPE_RESOURCE.equals(item.getType()) && item.getResource() != null) {
            return "[resource " + item.getResource().get("uri") + "]";
        }
        if (item.getType() != null && !item.isText()) {
            return "[" + item.getType() + " content omitted]";
        }
        return BINARY_MARKER;
    }

    private static Map<String, Object> subject(CapabilityKind kind, String key) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", kind.getWireName());
        payload.put(kind == CapabilityKind.RESOURCE ? "uri" : "name", key);
        return payload;
    }

    private static String operationName(CapabilityKind kind, String key) {
        return switch (kind) {
        case TOOL -> "tools/call '" + key + "'";
        case RESOURCE -> "resources/read '" + key + "'";
        case PROMPT -> "prompts/get '" + key + "'";
        };
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
