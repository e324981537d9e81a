package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Small builder for the JSON Schema objects published in {@code tools/list}.
 */
public final class InputSchema {

    private final ObjectNode schema;
    private final ObjectNode properties;
    private final ArrayNode required;

    private InputSchema(ObjectMapper mapper) {
        this.schema = mapper.createObjectNode().put("type", "object");
        this.properties = schema.putObject("properties");
        this.required = schema.putArray("required");
    }

    public static InputSchema object(ObjectMapper mapper) {
        return new InputSchema(mapper);
    }

    public InputSchema property(String name, String type, String description, boolean isRequired) {
        properties.putObject(name).put("type", type).put("description", description);
        if (isRequired) {
            required.add(name);
        }
        return this;
    }

    public InputSchema stringArray(String name, String description, boolean isRequired) {
        ObjectNode node = properties.putObject(name).put("type", "array").put("description", description);
        node.putObject("items").put("type", "string");
        if (isRequired) {
            required.add(name);
        }
        return this;
    }

    public ObjectNode build() {
        return schema;
    }
}
