package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response frame. Exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(String jsonrpc, JsonNode id, JsonNode result, JsonRpcError error) {

    public static JsonRpcResponse success(JsonNode id, JsonNode result) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, id, result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, id, null, error);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
