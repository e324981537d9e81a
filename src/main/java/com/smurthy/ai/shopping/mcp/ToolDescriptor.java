package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A callable operation published by a tool endpoint.
 */
public record ToolDescriptor(String name, String description, JsonNode inputSchema) {
}
