package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.shopping.support.ToolFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Raw JSON-RPC frames against the endpoints, as a remote client would send them.
 */
class ToolEndpointTest {

    private final ToolFixtures fixtures = new ToolFixtures();
    private final ObjectMapper mapper = fixtures.objectMapper;

    private JsonNode send(ToolEndpoint endpoint, String frame) throws Exception {
        return mapper.readTree(endpoint.handle(frame));
    }

    private static List<String> texts(JsonNode array, String field) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.path(field).asText()));
        return out;
    }

    @Test
    @DisplayName("initialize reports protocol version and server info")
    void initialize() throws Exception {
        JsonNode response = send(fixtures.catalogEndpoint,
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}");

        assertThat(response.path("id").asInt()).isEqualTo(1);
        assertThat(response.path("result").path("protocolVersion").asText()).isEqualTo(ToolEndpoint.PROTOCOL_VERSION);
        assertThat(response.path("result").path("serverInfo").path("name").asText()).isEqualTo("boutique");
    }

    @Test
    @DisplayName("tools/list publishes every tool with its input schema")
    void listTools() throws Exception {
        JsonNode response = send(fixtures.emissionsEndpoint,
                "{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"tools/list\"}");

        JsonNode tools = response.path("result").path("tools");
        assertThat(texts(tools, "name"))
                .containsExactly("calculate_product_co2", "calculate_shipping_co2", "shipping_options");
        assertThat(tools.get(0).path("inputSchema").path("required").get(0).asText()).isEqualTo("product_id");
    }

    @Test
    @DisplayName("tools/call returns structured content for the product footprint")
    void callProductFootprint() throws Exception {
        JsonNode response = send(fixtures.emissionsEndpoint, """
                {"jsonrpc":"2.0","id":7,"method":"tools/call",
                 "params":{"name":"calculate_product_co2","arguments":{"product_id":"OLJCESPC7Z","quantity":2}}}""");

        JsonNode content = response.path("result").path("structuredContent");
        assertThat(response.has("error")).isFalse();
        assertThat(content.path("footprint_kg_per_unit").asDouble()).isEqualTo(49.0);
        assertThat(content.path("footprint_kg").asDouble()).isEqualTo(98.0);
        assertThat(response.path("result").path("isError").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Unknown tool answers NOT_FOUND with the request id")
    void unknownTool() throws Exception {
        JsonNode response = send(fixtures.catalogEndpoint, """
                {"jsonrpc":"2.0","id":3,"method":"tools/call","params":{"name":"teleport","arguments":{}}}""");

        assertThat(response.path("id").asInt()).isEqualTo(3);
        assertThat(response.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.NOT_FOUND.code());
        assertThat(response.has("result")).isFalse();
    }

    @Test
    @DisplayName("Missing required argument answers INVALID_PARAMS")
    void missingArgument() throws Exception {
        JsonNode response = send(fixtures.catalogEndpoint, """
                {"jsonrpc":"2.0","id":4,"method":"tools/call","params":{"name":"get_product","arguments":{}}}""");

        assertThat(response.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.INVALID_PARAMS.code());
        assertThat(response.path("error").path("message").asText()).contains("product_id");
    }

    @Test
    @DisplayName("Unknown shipping method answers INVALID_PARAMS")
    void unknownShippingMethod() throws Exception {
        JsonNode response = send(fixtures.emissionsEndpoint, """
                {"jsonrpc":"2.0","id":5,"method":"tools/call",
                 "params":{"name":"calculate_shipping_co2","arguments":{"method":"teleport"}}}""");

        assertThat(response.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.INVALID_PARAMS.code());
    }

    @Test
    @DisplayName("Unknown method and malformed frames are answered, never thrown")
    void unknownMethodAndMalformedFrame() throws Exception {
        JsonNode unknown = send(fixtures.catalogEndpoint, "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"tools/delete\"}");
        JsonNode malformed = send(fixtures.catalogEndpoint, "{not json");
        JsonNode wrongVersion = send(fixtures.catalogEndpoint, "{\"jsonrpc\":\"1.0\",\"id\":8,\"method\":\"tools/list\"}");

        assertThat(unknown.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.NOT_FOUND.code());
        assertThat(malformed.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.INVALID_PARAMS.code());
        assertThat(malformed.path("id").isNull()).isTrue();
        assertThat(wrongVersion.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.INVALID_PARAMS.code());
    }

    @Test
    @DisplayName("resources/read returns the resource text")
    void readResource() throws Exception {
        JsonNode response = send(fixtures.catalogEndpoint, """
                {"jsonrpc":"2.0","id":9,"method":"resources/read","params":{"uri":"catalog://categories"}}""");

        JsonNode content = response.path("result").path("contents").get(0);
        assertThat(content.path("mimeType").asText()).isEqualTo("application/json");
        assertThat(content.path("text").asText()).contains("\"accessories\"", "\"kitchen\"");
    }

    @Test
    @DisplayName("prompts/get renders arguments and rejects missing required ones")
    void getPrompt() throws Exception {
        JsonNode rendered = send(fixtures.catalogEndpoint, """
                {"jsonrpc":"2.0","id":10,"method":"prompts/get",
                 "params":{"name":"product_recommendation","arguments":{"preferences":"gifts","budget":"30"}}}""");
        JsonNode missing = send(fixtures.catalogEndpoint, """
                {"jsonrpc":"2.0","id":11,"method":"prompts/get","params":{"name":"product_recommendation"}}""");

        assertThat(rendered.path("result").path("messages").get(0).path("content").path("text").asText())
                .contains("gifts").contains("30");
        assertThat(missing.path("error").path("code").asInt()).isEqualTo(ToolErrorCode.INVALID_PARAMS.code());
    }

    @Test
    @DisplayName("compare_products ranks greenest first and reports the savings")
    void compareProducts() throws Exception {
        JsonNode response = send(fixtures.comparisonEndpoint, """
                {"jsonrpc":"2.0","id":12,"method":"tools/call",
                 "params":{"name":"compare_products","arguments":{"product_ids":["6E92ZMYYFZ","1YMWWN1N4O"]}}}""");

        JsonNode content = response.path("result").path("structuredContent");
        assertThat(content.path("greenest").path("name").asText()).isEqualTo("Watch");
        assertThat(texts(content.path("products"), "id"))
                .containsExactly(ToolFixtures.WATCH, ToolFixtures.MUG);
        assertThat(content.path("savings_kg").asDouble()).isEqualTo(5.05);
    }
}
