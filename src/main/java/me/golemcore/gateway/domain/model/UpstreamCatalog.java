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

import java.util.List;

/**
 * Snapshot of everything the connected capability servers currently offer.
 */
public record UpstreamCatalog(
        List<CatalogEntry<ToolDescriptor>> tools,
        List<CatalogEntry<ResourceDescriptor>> resources,
        List<CatalogEntry<PromptDescriptor>> prompts) {

    public static UpstreamCatalog empty() {
        return new UpstreamCatalog(List.of(), List.of(), List.of());
    }

    public List<? extends CatalogEntry<?>> entriesOf(CapabilityKind kind) {
        return switch (kind) {
        case TOOL -> tools;
        case RESOURCE -> resources;
        case PROMPT -> prompts;
        };
    }
}
