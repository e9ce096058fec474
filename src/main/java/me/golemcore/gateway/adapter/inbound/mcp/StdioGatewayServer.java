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
package me.golemcore.gateway.adapter.inbound.mcp;

import me.golemcore.gateway.domain.exception.Futures;
import me.golemcore.gateway.domain.model.AgentIdentity;
import me.golemcore.gateway.domain.model.CallContext;
import me.golemcore.gateway.domain.service.AgentAuthService;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.CapabilityGatewayPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.UnaryOperator;

/**
 * Serves the gateway to a single agent over stdin/stdout, one JSON-RPC message
 * per line. The agent authenticates once at startup with credentials from
 * configuration or the environment; stdout carries protocol messages only.
 */
@Component
@ConditionalOnProperty(prefix = "gateway.stdio", name = "enabled", havingValue = "true")
@Slf4j
public class StdioGatewayServer {

    static final String ENV_CLIENT_ID = "MCP_CLIENT_ID";
    static final String ENV_API_KEY = "API_KEY";
    static final String ENV_CLIENT_SECRET = "MCP_CLIENT_SECRET";
    private static final String LOG_PREFIX = "[Stdio]";

    private final GatewayProperties properties;
    private final AgentAuthService authService;
    private final McpRequestDispatcher dispatcher;
    private final CapabilityGatewayPort gateway;
    private final InputStream input;
    private final PrintStream output;
    private final UnaryOperator<String> environment;
    private final String sessionId = "stdio-" + UUID.randomUUID();

    private volatile Thread readerThread;

    @Autowired
    public StdioGatewayServer(GatewayProperties properties, AgentAuthService authService,
            McpRequestDispatcher dispatcher, CapabilityGatewayPort gateway) {
        this(properties, authService, dispatcher, gateway, System.in, System.out, System::getenv);
    }

    StdioGatewayServer(GatewayProperties properties, AgentAuthService authService, McpRequestDispatcher dispatcher,
            CapabilityGatewayPort gateway, InputStream input, OutputStream output,
            UnaryOperator<String> environment) {
        this.properties = properties;
        this.authService = authService;
        this.dispatcher = dispatcher;
        this.gateway = gateway;
        this.input = input;
        this.output = output instanceof PrintStream printStream ? printStream
                : new PrintStream(output, true, StandardCharsets.UTF_8);
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Thread thread = new Thread(this::serve, "mcp-stdio");
        thread.setDaemon(false);
        readerThread = thread;
        thread.start();
    }

    @PreDestroy
    public void stop() {
        Thread thread = readerThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Authenticates and then serves requests until stdin closes.
     *
     * @return {@code false} when authentication failed and nothing was served
     */
    boolean serve() {
        AgentIdentity agent;
        try {
            agent = authService.authenticate(resolveClientId(), resolveSecret()).join();
        } catch (CompletionException e) {
            log.error("{} Authentication failed: {}", LOG_PREFIX, Futures.unwrap(e).getMessage());
            return false;
        }
        log.info("{} Agent {} connected over stdio", LOG_PREFIX, agent.getDisplayName());

        CallContext session = CallContext.of(agent, sessionId);
        gateway.agentConnected(session).join();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                dispatcher.handle(session.withNewCorrelationId(), line).whenComplete((response, ex) -> {
                    if (ex != null) {
                        log.warn("{} Request failed: {}", LOG_PREFIX, Futures.unwrap(ex).getMessage());
                    } else {
                        response.ifPresent(this::write);
                    }
                });
            }
        } catch (IOException e) {
            log.warn("{} stdin read failed: {}", LOG_PREFIX, e.getMessage());
        } finally {
            dispatcher.cancelSession(session);
            gateway.agentDisconnected(session).join();
            log.info("{} Agent {} disconnected", LOG_PREFIX, agent.getDisplayName());
        }
        return true;
    }

    private synchronized void write(String message) {
        output.println(message);
        output.flush();
    }

    private String resolveClientId() {
        String configured = properties.getStdio().getClientId();
        return hasText(configured) ? configured : environment.apply(ENV_CLIENT_ID);
    }

    private String resolveSecret() {
        String configured = properties.getStdio().getClientSecret();
        if (hasText(configured)) {
            return configured;
        }
        String apiKey = environment.apply(ENV_API_KEY);
        return hasText(apiKey) ? apiKey : environment.apply(ENV_CLIENT_SECRET);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
