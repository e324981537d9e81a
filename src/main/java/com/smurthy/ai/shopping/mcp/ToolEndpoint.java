package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Tool Endpoint
 *
 * Server side of the tool transport. Subclasses register tools, resources and prompt
 * templates at construction time; after that the endpoint only answers JSON-RPC frames and
 * holds no per-call state, so it is safe to call concurrently.
 *
 * Supported methods: {@code initialize}, {@code tools/list}, {@code tools/call},
 * {@code resources/list}, {@code resources/read}, {@code prompts/list}, {@code prompts/get}.
 */
public abstract class ToolEndpoint {

    public static final String PROTOCOL_VERSION = "2024-11-05";

    private static final Logger log = LoggerFactory.getLogger(ToolEndpoint.class);

    private record RegisteredTool(ToolDescriptor descriptor, ToolFunction function) {}

    private record RegisteredResource(ResourceDescriptor descriptor, Supplier<String> content) {}

    protected final ObjectMapper objectMapper;
    private final String endpointId;
    private final String version;
    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();
    private final Map<String, RegisteredResource> resources = new LinkedHashMap<>();
    private final Map<String, PromptTemplate> prompts = new LinkedHashMap<>();

    protected ToolEndpoint(String endpointId, String version, ObjectMapper objectMapper) {
        this.endpointId = endpointId;
        this.version = version;
        this.objectMapper = objectMapper;
    }

    public String endpointId() {
        return endpointId;
    }

    public String version() {
        return version;
    }

    public int toolCount() {
        return tools.size();
    }

    public int resourceCount() {
        return resources.size();
    }

    public int promptCount() {
        return prompts.size();
    }

    protected void registerTool(ToolDescriptor descriptor, ToolFunction function) {
        tools.put(descriptor.name(), new RegisteredTool(descriptor, function));
        log.debug("[{}] registered tool {}", endpointId, descriptor.name());
    }

    protected void registerResource(ResourceDescriptor descriptor, Supplier<String> content) {
        resources.put(descriptor.uri(), new RegisteredResource(descriptor, content));
        log.debug("[{}] registered resource {}", endpointId, descriptor.uri());
    }

    protected void registerPrompt(PromptTemplate prompt) {
        prompts.put(prompt.name(), prompt);
        log.debug("[{}] registered prompt {}", endpointId, prompt.name());
    }

    /**
     * Answers a raw JSON frame with a raw JSON frame. Never throws.
     */
    public String handle(String frame) {
        JsonRpcResponse response;
        try {
            JsonNode node = objectMapper.readTree(frame);
            response = handle(objectMapper.treeToValue(node, JsonRpcRequest.class));
        } catch (JsonProcessingException e) {
            response = JsonRpcResponse.failure(NullNode.getInstance(),
                    JsonRpcError.of(ToolErrorCode.INVALID_PARAMS, "Malformed JSON-RPC frame: " + e.getOriginalMessage()));
        }
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("[{}] failed to encode response", endpointId, e);
            return "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":" + ToolErrorCode.UPSTREAM_UNAVAILABLE.code()
                    + ",\"message\":\"Failed to encode response\"}}";
        }
    }

    public JsonRpcResponse handle(JsonRpcRequest request) {
        JsonNode id = request == null || request.id() == null ? NullNode.getInstance() : request.id();
        if (request == null || !JsonRpcRequest.VERSION.equals(request.jsonrpc())
                || request.method() == null || request.method().isBlank()) {
            return JsonRpcResponse.failure(id, JsonRpcError.of(ToolErrorCode.INVALID_PARAMS, "Invalid JSON-RPC request"));
        }
        JsonNode params = request.params() == null || request.params().isNull()
                ? objectMapper.createObjectNode()
                : request.params();
        try {
            JsonNode result = switch (request.method()) {
                case "initialize" -> initialize();
                case "tools/list" -> listTools();
                case "tools/call" -> callTool(params);
                case "resources/list" -> listResources();
                case "resources/read" -> readResource(params);
                case "prompts/list" -> listPrompts();
                case "prompts/get" -> getPrompt(params);
                default -> throw new ToolInvocationException(ToolErrorCode.NOT_FOUND,
                        "Method '" + request.method() + "' not found");
            };
            return JsonRpcResponse.success(id, result);
        } catch (ToolInvocationException e) {
            log.debug("[{}] {} failed: {} {}", endpointId, request.method(), e.getCode(), e.getMessage());
            return JsonRpcResponse.failure(id, e.toError());
        } catch (IllegalArgumentException e) {
            return JsonRpcResponse.failure(id, JsonRpcError.of(ToolErrorCode.INVALID_PARAMS, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[{}] {} failed unexpectedly", endpointId, request.method(), e);
            return JsonRpcResponse.failure(id,
                    JsonRpcError.of(ToolErrorCode.UPSTREAM_UNAVAILABLE, "Internal error: " + e.getMessage()));
        }
    }

    private JsonNode initialize() {
        ObjectNode result = objectMapper.createObjectNode().put("protocolVersion", PROTOCOL_VERSION);
        ObjectNode capabilities = result.putObject("capabilities");
        capabilities.putObject("tools");
        capabilities.putObject("resources");
        capabilities.putObject("prompts");
        result.putObject("serverInfo").put("name", endpointId).put("version", version);
        return result;
    }

    private JsonNode listTools() {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode list = result.putArray("tools");
        tools.values().forEach(t -> list.add(objectMapper.valueToTree(t.descriptor())));
        return result;
    }

    private JsonNode callTool(JsonNode params) {
        String name = requireText(params, "name");
        RegisteredTool tool = tools.get(name);
        if (tool == null) {
            throw new ToolInvocationException(ToolErrorCode.NOT_FOUND, "Tool '" + name + "' not found");
        }
        JsonNode arguments = params.hasNonNull("arguments") ? params.get("arguments") : objectMapper.createObjectNode();
        JsonNode output = tool.function().call(arguments);

        ObjectNode result = objectMapper.createObjectNode();
        result.putArray("content").addObject().put("type", "text").put("text", output.toString());
        result.set("structuredContent", output);
        result.put("isError", false);
        return result;
    }

    private JsonNode listResources() {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode list = result.putArray("resources");
        resources.values().forEach(r -> list.add(objectMapper.valueToTree(r.descriptor())));
        return result;
    }

    private JsonNode readResource(JsonNode params) {
        String uri = requireText(params, "uri");
        RegisteredResource resource = resources.get(uri);
        if (resource == null) {
            throw new ToolInvocationException(ToolErrorCode.NOT_FOUND, "Resource '" + uri + "' not found");
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.putArray("contents").addObject()
                .put("uri", uri)
                .put("mimeType", resource.descriptor().mimeType())
                .put("text", resource.content().get());
        return result;
    }

    private JsonNode listPrompts() {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode list = result.putArray("prompts");
        prompts.values().forEach(p -> list.add(objectMapper.valueToTree(p)));
        return result;
    }

    private JsonNode getPrompt(JsonNode params) {
        String name = requireText(params, "name");
        PromptTemplate prompt = prompts.get(name);
        if (prompt == null) {
            throw new ToolInvocationException(ToolErrorCode.NOT_FOUND, "Prompt '" + name + "' not found");
        }
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode arguments = params.path("arguments");
        arguments.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));

        ObjectNode result = objectMapper.createObjectNode().put("description", prompt.description());
        result.putArray("messages").addObject()
                .put("role", "user")
                .putObject("content").put("type", "text").put("text", prompt.render(values));
        return result;
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ---- argument helpers for subclasses ----

    protected static String requireText(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new ToolInvocationException(ToolErrorCode.INVALID_PARAMS, "Missing required parameter: " + field);
        }
        return value.asText();
    }

    protected static String optionalText(JsonNode args, String field) {
        JsonNode value = args.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    protected static Double optionalNumber(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new ToolInvocationException(ToolErrorCode.INVALID_PARAMS, "Parameter " + field + " must be a number");
        }
        return value.asDouble();
    }

    protected static List<String> requireTextList(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || !value.isArray() || value.isEmpty()) {
            throw new ToolInvocationException(ToolErrorCode.INVALID_PARAMS, "Parameter " + field + " must be a non-empty array");
        }
        List<String> out = new ArrayList<>(value.size());
        value.forEach(n -> out.add(n.asText()));
        return List.copyOf(out);
    }
}
