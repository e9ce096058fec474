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
package me.golemcore.gateway.adapter.outbound.mcp;

import me.golemcore.gateway.domain.exception.ConfigurationException;
import me.golemcore.gateway.domain.model.CapabilityServer;
import me.golemcore.gateway.domain.model.ServerTransport;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds the transport described by a server's registry record.
 */
@Component
public class McpTransportFactory {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private final WebClient webClient;

    public McpTransportFactory() {
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }

    /**
     * @throws ConfigurationException
     *             if the transport descriptor is missing or incomplete
     */
    public McpTransport create(CapabilityServer server) {
        ServerTransport transport = server.getTransport();
        if (transport == null) {
            throw new ConfigurationException("Server '" + server.getId() + "' has no transport descriptor");
        }
        transport.validate();
        String name = server.getDisplayName();
        return switch (transport.getType()) {
        case COMMAND -> new StdioMcpTransport(name, transport.getCommand(), transport.argsOrEmpty(),
                transport.envOrEmpty());
        case STREAMABLE_HTTP -> new StreamableHttpMcpTransport(name, webClient, transport.getUrl(),
                transport.headersOrEmpty());
        case SSE -> new SseMcpTransport(name, webClient, transport.getUrl(), transport.headersOrEmpty());
        };
    }
}
