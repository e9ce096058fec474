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
package me.golemcore.gateway.domain.exception;

/**
 * Error kinds surfaced to agents, each with its JSON-RPC error code.
 */
public enum GatewayErrorKind {

    AUTHENTICATION_FAILURE("authentication_failure", -32001),
    NOT_FOUND("not_found", -32002),
    PERMISSION_DENIED("permission_denied", -32003),
    PERMISSION_REVOKED("permission_revoked", -32004),
    UPSTREAM_TIMEOUT("upstream_timeout", -32008),
    UPSTREAM_EXECUTION_ERROR("upstream_execution_error", -32010),
    CONFIGURATION_ERROR("configuration_error", -32011),
    VALIDATION_ERROR("validation_error", -32602);

    private final String wireName;
    private final int jsonRpcCode;

    GatewayErrorKind(String wireName, int jsonRpcCode) {
        this.wireName = wireName;
        this.jsonRpcCode = jsonRpcCode;
    }

    public String getWireName() {
        return wireName;
    }

    public int getJsonRpcCode() {
        return jsonRpcCode;
    }
}
