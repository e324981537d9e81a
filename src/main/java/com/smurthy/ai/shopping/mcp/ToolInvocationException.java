package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.ShoppingAssistantException;

/**
 * Structured transport-level failure, carrying the endpoint's error code.
 */
public class ToolInvocationException extends ShoppingAssistantException {

    private final ToolErrorCode code;
    private final transient JsonNode data;

    public ToolInvocationException(ToolErrorCode code, String message) {
        this(code, message, null);
    }

    public ToolInvocationException(ToolErrorCode code, String message, JsonNode data) {
        super(ErrorKind.UPSTREAM_INVOCATION_ERROR, message);
        this.code = code;
        this.data = data;
    }

    public ToolErrorCode getCode() {
        return code;
    }

    public JsonNode getData() {
        return data;
    }

    @Override
    public boolean isTransient() {
        return code.isTransient();
    }

    public JsonRpcError toError() {
        return new JsonRpcError(code.code(), getMessage(), data);
    }
}
