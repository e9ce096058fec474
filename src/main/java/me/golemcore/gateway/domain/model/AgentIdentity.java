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
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A credentialed caller with a bounded set of permitted capabilities.
 *
 * <p>
 * Only a one-way hash of the client secret is kept. The plaintext is handed
 * out once by {@link me.golemcore.gateway.domain.service.AgentAuthService#register}
 * and never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentIdentity {

    private String id;
    private String clientId;

    @ToString.Exclude
    private String clientSecretHash;

    private String name;
    private String description;

    @Builder.Default
    private List<String> allowedToolIds = new ArrayList<>();

    @Builder.Default
    private List<String> allowedResourceIds = new ArrayList<>();

    @Builder.Default
    private List<String> allowedPromptIds = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Grant list for one capability kind, never null.
     */
    public List<String> grantsFor(CapabilityKind kind) {
        List<String> grants = switch (kind) {
        case TOOL -> allowedToolIds;
        case RESOURCE -> allowedResourceIds;
        case PROMPT -> allowedPromptIds;
        };
        return grants != null ? grants : List.of();
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : clientId;
    }
}
