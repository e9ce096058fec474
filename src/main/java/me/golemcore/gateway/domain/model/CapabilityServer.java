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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A registered capability server and its connection counters.
 *
 * <p>
 * Invariant: {@code status == ACTIVE} iff {@code connectedInstances > 0}, and
 * {@code connectedInstances} never drops below zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityServer {

    private String id;
    private String name;
    private String description;
    private ServerTransport transport;

    @Builder.Default
    private ServerStatus status = ServerStatus.REGISTERED;

    private int connectedInstances;
    private long totalConnections;
    private Instant lastConnectedAt;
    private Instant lastDisconnectedAt;

    public void incrementConnection(Instant now) {
        connectedInstances++;
        totalConnections++;
        lastConnectedAt = now;
        status = ServerStatus.ACTIVE;
    }

    public void decrementConnection(Instant now) {
        if (connectedInstances > 0) {
            connectedInstances--;
        }
        lastDisconnectedAt = now;
        if (connectedInstances == 0) {
            status = ServerStatus.REGISTERED;
        }
    }

    @JsonIgnore
    public boolean isConnected() {
        return connectedInstances > 0;
    }

    @JsonIgnore
    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
