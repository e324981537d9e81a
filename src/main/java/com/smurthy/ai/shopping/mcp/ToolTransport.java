package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.orchestration.CallContext;

import java.util.Map;

/**
 * Uniform discover/invoke boundary used by handlers to reach external capabilities.
 *
 * Implementations are stateless request/response channels: they never retry, and every
 * failure is reported as a {@link ToolInvocationException} carrying a {@link ToolErrorCode}.
 */
public interface ToolTransport {

    EndpointManifest discover(String endpointId);

    /**
     * @return the tool's structured output
     * @throws ToolInvocationException on any endpoint or transport error
     * @throws java.util.concurrent.CancellationException if the call context was cancelled
     */
    JsonNode invoke(String endpointId, String toolName, Map<String, ?> arguments, CallContext context);

    default JsonNode invoke(String endpointId, String toolName, Map<String, ?> arguments) {
        return invoke(endpointId, toolName, arguments, CallContext.none());
    }

    String readResource(String endpointId, String uri);

    String renderPrompt(String endpointId, String promptName, Map<String, String> arguments);
}
