package com.smurthy.ai.shopping.mcp;

import java.util.List;

/**
 * Everything an endpoint publishes, as returned by discovery.
 */
public record EndpointManifest(
        String endpointId,
        List<ToolDescriptor> tools,
        List<ResourceDescriptor> resources,
        List<PromptTemplate> prompts
) {
    public boolean hasTool(String name) {
        return tools.stream().anyMatch(t -> t.name().equals(name));
    }
}
