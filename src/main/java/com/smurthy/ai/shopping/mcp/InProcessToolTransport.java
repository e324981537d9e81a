package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.shopping.observability.AssistantMetrics;
import com.smurthy.ai.shopping.orchestration.CallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tool transport for endpoints hosted in this process.
 *
 * Each call is framed exactly as it would be on the wire: the request is encoded to a
 * JSON-RPC string, answered by the endpoint as a string, and decoded again. The deadline and
 * cancellation signal of the call are checked before the frame is sent, and a response that
 * arrives after the deadline is discarded as a timeout.
 */
@Service
public class InProcessToolTransport implements ToolTransport {

    private static final Logger log = LoggerFactory.getLogger(InProcessToolTransport.class);

    private final Map<String, ToolEndpoint> endpoints;
    private final ObjectMapper objectMapper;
    private final AssistantMetrics metrics;
    private final AtomicLong requestIds = new AtomicLong();

    public InProcessToolTransport(List<ToolEndpoint> endpoints, ObjectMapper objectMapper, AssistantMetrics metrics) {
        this.endpoints = endpoints.stream()
                .collect(Collectors.toUnmodifiableMap(ToolEndpoint::endpointId, Function.identity()));
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        log.info("Tool transport initialized with endpoints: {}", this.endpoints.keySet());
    }

    public Set<String> endpointIds() {
        return endpoints.keySet();
    }

    public Optional<ToolEndpoint> findEndpoint(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    @Override
    public EndpointManifest discover(String endpointId) {
        JsonNode tools = call(endpointId, "tools/list", objectMapper.createObjectNode(), CallContext.none());
        JsonNode resources = call(endpointId, "resources/list", objectMapper.createObjectNode(), CallContext.none());
        JsonNode prompts = call(endpointId, "prompts/list", objectMapper.createObjectNode(), CallContext.none());

        List<ToolDescriptor> toolList = new ArrayList<>();
        tools.path("tools").forEach(t -> toolList.add(new ToolDescriptor(
                t.path("name").asText(), t.path("description").asText(), t.path("inputSchema"))));

        List<ResourceDescriptor> resourceList = new ArrayList<>();
        resources.path("resources").forEach(r -> resourceList.add(new ResourceDescriptor(
                r.path("uri").asText(), r.path("name").asText(),
                r.path("description").asText(null), r.path("mimeType").asText(null))));

        List<PromptTemplate> promptList = new ArrayList<>();
        prompts.path("prompts").forEach(p -> {
            List<PromptTemplate.Argument> arguments = new ArrayList<>();
            p.path("arguments").forEach(a -> arguments.add(new PromptTemplate.Argument(
                    a.path("name").asText(), a.path("description").asText(), a.path("required").asBoolean())));
            promptList.add(new PromptTemplate(p.path("name").asText(), p.path("description").asText(), arguments, null));
        });

        return new EndpointManifest(endpointId, List.copyOf(toolList), List.copyOf(resourceList), List.copyOf(promptList));
    }

    @Override
    public JsonNode invoke(String endpointId, String toolName, Map<String, ?> arguments, CallContext context) {
        ObjectNode params = objectMapper.createObjectNode().put("name", toolName);
        params.set("arguments", objectMapper.valueToTree(arguments == null ? Map.of() : arguments));
        JsonNode result = call(endpointId, "tools/call", params, context);
        return result.path("structuredContent");
    }

    @Override
    public String readResource(String endpointId, String uri) {
        ObjectNode params = objectMapper.createObjectNode().put("uri", uri);
        JsonNode result = call(endpointId, "resources/read", params, CallContext.none());
        return result.path("contents").path(0).path("text").asText();
    }

    @Override
    public String renderPrompt(String endpointId, String promptName, Map<String, String> arguments) {
        ObjectNode params = objectMapper.createObjectNode().put("name", promptName);
        params.set("arguments", objectMapper.valueToTree(arguments == null ? Map.of() : arguments));
        JsonNode result = call(endpointId, "prompts/get", params, CallContext.none());
        return result.path("messages").path(0).path("content").path("text").asText();
    }

    private JsonNode call(String endpointId, String method, JsonNode params, CallContext context) {
        ToolEndpoint endpoint = endpoints.get(endpointId);
        if (endpoint == null) {
            throw new ToolInvocationException(ToolErrorCode.NOT_FOUND, "Unknown tool endpoint: " + endpointId);
        }
        metrics.recordToolCall(endpointId);
        try {
            return send(endpoint, method, params, context);
        } catch (RuntimeException e) {
            metrics.recordToolError(endpointId);
            throw e;
        }
    }

    private JsonNode send(ToolEndpoint endpoint, String method, JsonNode params, CallContext context) {
        String endpointId = endpoint.endpointId();
        context.cancellationToken().throwIfCancelled();
        if (context.isExpired()) {
            throw new ToolInvocationException(ToolErrorCode.TIMEOUT,
                    "Deadline expired before calling " + endpointId + " " + method);
        }

        JsonRpcRequest request = JsonRpcRequest.of(LongNode.valueOf(requestIds.incrementAndGet()), method, params);
        String responseFrame = endpoint.handle(encode(request));
        JsonRpcResponse response = decode(responseFrame);

        if (context.isExpired()) {
            throw new ToolInvocationException(ToolErrorCode.TIMEOUT,
                    endpointId + " " + method + " answered after the deadline");
        }
        if (response.hasError()) {
            JsonRpcError error = response.error();
            log.debug("{} {} returned error {}: {}", endpointId, method, error.code(), error.message());
            throw new ToolInvocationException(ToolErrorCode.fromCode(error.code()), error.message(), error.data());
        }
        return response.result();
    }

    private String encode(JsonRpcRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException(ToolErrorCode.INVALID_PARAMS, "Cannot encode request: " + e.getOriginalMessage());
        }
    }

    private JsonRpcResponse decode(String frame) {
        try {
            return objectMapper.readValue(frame, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException(ToolErrorCode.UPSTREAM_UNAVAILABLE, "Cannot decode response: " + e.getOriginalMessage());
        }
    }
}
