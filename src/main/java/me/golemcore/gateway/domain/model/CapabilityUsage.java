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
 * Per agent and capability invocation counter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityUsage {

    private String agentId;
    private String capabilityId;
    private CapabilityKind kind;
    private String serverId;
    private long totalCount;
    private Instant firstUsedAt;
    private Instant lastUsedAt;

    public void recordUse(Instant now) {
        if (firstUsedAt == null) {
            firstUsedAt = now;
        }
        lastUsedAt = now;
        totalCount++;
    }
}
