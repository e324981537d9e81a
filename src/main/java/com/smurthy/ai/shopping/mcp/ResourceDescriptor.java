package com.smurthy.ai.shopping.mcp;

/**
 * A readable resource published by a tool endpoint.
 */
public record ResourceDescriptor(String uri, String name, String description, String mimeType) {
}
