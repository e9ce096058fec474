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
package me.golemcore.gateway.adapter.inbound.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 response. Exactly one of {@code result} and {@code error} is
 * set; {@code id} is always written, as {@code null} when the request id could
 * not be read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JsonRpcResponse {

    @Builder.Default
    private String jsonrpc = "2.0";

    @Builder.Default
    private JsonNode id = NullNode.getInstance();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Object result;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private JsonRpcError error;

    public static JsonRpcResponse success(JsonNode id, Object result) {
        return JsonRpcResponse.builder().id(orNull(id)).result(result).build();
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return JsonRpcResponse.builder().id(orNull(id)).error(error).build();
    }

    private static JsonNode orNull(JsonNode id) {
        return id != null ? id : NullNode.getInstance();
    }
}
