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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per agent and server activity: connection state and totals by kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerUsage {

    private String agentId;
    private String serverId;
    private boolean connected;
    private Instant connectedAt;
    private Instant disconnectedAt;
    private long totalToolCalls;
    private long totalResourceReads;
    private long totalPromptGets;
    private Instant lastActivityAt;

    public void markConnected(Instant now) {
        connected = true;
        connectedAt = now;
        lastActivityAt = now;
    }

    public void markDisconnected(Instant now) {
        connected = false;
        disconnectedAt = now;
        lastActivityAt = now;
    }

    public void recordActivity(CapabilityKind kind, Instant now) {
        switch (kind) {
        case TOOL -> totalToolCalls++;
        case RESOURCE -> totalResourceReads++;
        case PROMPT -> totalPromptGets++;
        }
        lastActivityAt = now;
    }
}
