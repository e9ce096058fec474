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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of audit events written by the gateway.
 */
public enum AuditEventType {

    CALL_ATTEMPT("call_attempt"),
    READ_ATTEMPT("read_attempt"),
    PROMPT_ATTEMPT("prompt_attempt"),
    ACCESS_DENIED("access_denied"),
    ACCESS_REVOKED("access_revoked"),
    TOOL_RESULT("tool_result"),
    RESOURCE_RESULT("resource_result"),
    PROMPT_RESULT("prompt_result"),
    TOOL_ERROR("tool_error"),
    RESOURCE_ERROR("resource_error"),
    PROMPT_ERROR("prompt_error"),
    LIST_ERROR("list_error"),
    AGENT_CONNECTED("agent_connected"),
    AGENT_DISCONNECTED("agent_disconnected"),
    AUTHENTICATION_FAILED("authentication_failed");

    private final String wireName;

    AuditEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static AuditEventType attemptOf(CapabilityKind kind) {
        return switch (kind) {
        case TOOL -> CALL_ATTEMPT;
        case RESOURCE -> READ_ATTEMPT;
        case PROMPT -> PROMPT_ATTEMPT;
        };
    }

    public static AuditEventType resultOf(CapabilityKind kind) {
        return switch (kind) {
        case TOOL -> TOOL_RESULT;
        case RESOURCE -> RESOURCE_RESULT;
        case PROMPT -> PROMPT_RESULT;
        };
    }

    public static AuditEventType errorOf(CapabilityKind kind) {
        return switch (kind) {
        case TOOL -> TOOL_ERROR;
        case RESOURCE -> RESOURCE_ERROR;
        case PROMPT -> PROMPT_ERROR;
        };
    }
}
