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
package me.golemcore.gateway.adapter.inbound.web.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.AuthenticationFailureException;
import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.exception.GatewayErrorKind;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.AuditEventType;
import me.golemcore.gateway.domain.model.AuditSeverity;
import me.golemcore.gateway.domain.service.AgentAuthService;
import me.golemcore.gateway.domain.service.AuditLogger;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates agents on the MCP endpoints before any gateway logic runs.
 *
 * <p>
 * Credentials come from the configured header pair (default
 * {@code MCP_CLIENT_ID} / {@code API_KEY}) or from
 * {@code Authorization: Basic base64(clientId:secret)}. Missing, malformed or
 * wrong credentials are answered with 401. On success the
 * {@link AgentIdentity} is stored under {@link #AGENT_ATTRIBUTE} for the
 * duration of the exchange.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentCredentialsAuthenticationFilter implements WebFilter {

    public static final String AGENT_ATTRIBUTE = AgentCredentialsAuthenticationFilter.class.getName() + ".agent";
    static final List<String> PROTECTED_PATHS = List.of("/mcp", "/ws/mcp");

    private static final String BASIC_PREFIX = "basic ";
    private static final String ROLE_AGENT = "ROLE_AGENT";

    private final AgentAuthService authService;
    private final AuditLogger auditLogger;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // also registered as a plain WebFilter bean; authenticate once per exchange
        if (!requiresAuthentication(exchange.getRequest()) || exchange.getAttribute(AGENT_ATTRIBUTE) != null) {
            return chain.filter(exchange);
        }
        Optional<Credentials> credentials = extractCredentials(exchange.getRequest());
        if (credentials.isEmpty()) {
            log.debug("[Auth] Rejected {}: missing or malformed credentials",
                    exchange.getRequest().getPath().value());
            auditFailure(null, "Missing or malformed credentials");
            return reject(exchange, "Missing or malformed credentials");
        }

        Credentials presented = credentials.get();
        return Mono.fromFuture(() -> authService.authenticate(presented.clientId(), presented.secret()))
                .map(Optional::of)
                .onErrorResume(ex -> Futures.unwrap(ex) instanceof AuthenticationFailureException,
                        ex -> Mono.just(Optional.<AgentIdentity>empty()))
                .flatMap(agent -> {
                    if (agent.isEmpty()) {
                        auditFailure(presented.clientId(), "Invalid client credentials");
                        return reject(exchange, "Invalid client credentials");
                    }
                    exchange.getAttributes().put(AGENT_ATTRIBUTE, agent.get());
                    Authentication auth = new UsernamePasswordAuthenticationToken(
                            agent.get().getId(), null, List.of(new SimpleGrantedAuthority(ROLE_AGENT)));
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                });
    }

    Optional<Credentials> extractCredentials(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        GatewayProperties.AuthProperties auth = properties.getAuth();
        String clientId = headers.getFirst(auth.getClientIdHeader());
        String secret = headers.getFirst(auth.getSecretHeader());
        if (hasText(clientId) && hasText(secret)) {
            return Optional.of(new Credentials(clientId.trim(), secret));
        }
        return parseBasic(headers.getFirst(HttpHeaders.AUTHORIZATION));
    }

    private static Optional<Credentials> parseBasic(String header) {
        if (header == null || header.length() <= BASIC_PREFIX.length()
                || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return Optional.empty();
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int separator = decoded.indexOf(':');
        if (separator <= 0 || separator == decoded.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, separator), decoded.substring(separator + 1)));
    }

    private static boolean requiresAuthentication(ServerHttpRequest request) {
        String path = request.getPath().pathWithinApplication().value();
        return PROTECTED_PATHS.contains(path);
    }

    private void auditFailure(String clientId, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (clientId != null) {
            payload.put("clientId", clientId);
        }
        payload.put("reason", reason);
        auditLogger.record(null, null, UUID.randomUUID().toString(), AuditEventType.AUTHENTICATION_FAILED,
                AuditSeverity.WARNING, payload);
    }

    private Mono<Void> reject(ServerWebExchange exchange, String message) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.UNAUTHORIZED.value())
                .kind(GatewayErrorKind.AUTHENTICATION_FAILURE.getWireName())
                .message(message)
                .build();
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("[Auth] Failed to encode 401 body: {}", e.getMessage());
            return response.setComplete();
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    record Credentials(String clientId, String secret) {

        @Override
        public String toString() {
            return "Credentials[clientId=" + clientId + ", secret=***]";
        }
    }
}
