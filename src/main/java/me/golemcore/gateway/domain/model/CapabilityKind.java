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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The three kinds of capability a capability server can offer.
 */
public enum CapabilityKind {

    @JsonProperty("tool")
    TOOL("tool"),

    @JsonProperty("resource")
    RESOURCE("resource"),

    @JsonProperty("prompt")
    PROMPT("prompt");

    private final String wireName;

    CapabilityKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
