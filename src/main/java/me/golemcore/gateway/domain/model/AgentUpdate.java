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

import java.util.List;

/**
 * Partial update of an agent identity. A {@code null} field is left untouched;
 * a supplied grant list replaces the stored one entirely.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentUpdate {

    private String name;
    private String description;
    private List<String> toolIds;
    private List<String> resourceIds;
    private List<String> promptIds;

    public boolean hasGrantChanges() {
        return toolIds != null || resourceIds != null || promptIds != null;
    }
}
