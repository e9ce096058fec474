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

/**
 * Registry record of a single tool, resource or prompt. Grants reference these
 * records by {@link #id}.
 *
 * <p>
 * A record is matched against the live upstream catalog by owning server and
 * lookup key: the URI for resources, the name otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Capability {

    private String id;
    private String serverId;
    private CapabilityKind kind;
    private String name;
    private String description;
    private String uri;
    private String mimeType;

    @JsonIgnore
    public String getLookupKey() {
        if (kind == CapabilityKind.RESOURCE && uri != null && !uri.isBlank()) {
            return uri;
        }
        return name;
    }
}
