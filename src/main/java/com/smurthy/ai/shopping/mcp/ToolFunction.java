package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ToolFunction {

    JsonNode call(JsonNode arguments);
}
