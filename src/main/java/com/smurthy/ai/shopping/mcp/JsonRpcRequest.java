package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 request frame.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcRequest(String jsonrpc, JsonNode id, String method, JsonNode params) {

    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(JsonNode id, String method, JsonNode params) {
        return new JsonRpcRequest(VERSION, id, method, params);
    }
}
