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
package me.golemcore.gateway.domain.model;

import me.golemcore.gateway.domain.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport descriptor of a capability server: either a subprocess command
 * (with args and env) or a URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerTransport {

    @Builder.Default
    private TransportType type = TransportType.COMMAND;

    private String command;

    @Builder.Default
    private List<String> args = new ArrayList<>();

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    private String url;

    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * Rejects descriptors that cannot be turned into a connection.
     *
     * @throws ConfigurationException
     *             if the descriptor is incomplete for its transport type
     */
    public void validate() {
        if (type == null) {
            throw new ConfigurationException("Transport type is missing");
        }
        if (type == TransportType.COMMAND) {
            if (command == null || command.isBlank()) {
                throw new ConfigurationException("Command transport requires a command");
            }
            return;
        }
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("Transport '" + type + "' requires a url");
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new ConfigurationException("Unsupported url scheme: " + url);
        }
    }

    public List<String> argsOrEmpty() {
        return args != null ? args : List.of();
    }

    public Map<String, String> envOrEmpty() {
        return env != null ? env : Map.of();
    }

    public Map<String, String> headersOrEmpty() {
        return headers != null ? headers : Map.of();
    }
}
