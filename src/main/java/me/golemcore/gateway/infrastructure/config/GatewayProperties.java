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
package me.golemcore.gateway.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration of the gateway, bound from application.yml under the
 * {@code gateway.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - durable store location</li>
 * <li>{@link UpstreamProperties} - capability server sessions and timeouts</li>
 * <li>{@link AuthProperties} - credential header names</li>
 * <li>{@link AuditProperties} - audit trail</li>
 * <li>{@link UsageProperties} - usage counters</li>
 * <li>{@link StdioProperties} - stdio inbound transport</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private StorageProperties storage = new StorageProperties();
    private UpstreamProperties upstream = new UpstreamProperties();
    private AuthProperties auth = new AuthProperties();
    private AuditProperties audit = new AuditProperties();
    private UsageProperties usage = new UsageProperties();
    private StdioProperties stdio = new StdioProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    @Data
    public static class UpstreamProperties {
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration listTimeout = Duration.ofSeconds(10);
        private Duration startupTimeout = Duration.ofSeconds(30);
        private boolean connectOnStartup = true;
        private Duration reconnectInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class AuthProperties {
        private String clientIdHeader = "MCP_CLIENT_ID";
        private String secretHeader = "API_KEY";
    }

    @Data
    public static class AuditProperties {
        private boolean enabled = true;
        private int previewChars = 500;
    }

    @Data
    public static class UsageProperties {
        private boolean enabled = true;
    }

    @Data
    public static class StdioProperties {
        private boolean enabled = false;
        private String clientId;
        private String clientSecret;
    }
}
