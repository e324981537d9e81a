package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ToolTransportControllerTest extends BaseIntegrationTest {

    private ResultActions frame(String endpoint, String json) throws Exception {
        return mockMvc.perform(post("/mcp/{id}", endpoint).contentType(MediaType.APPLICATION_JSON).content(json));
    }

    @Test
    @DisplayName("tools/list over HTTP returns the catalog tools")
    void listsCatalogTools() throws Exception {
        frame("boutique", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.result.tools[*].name", hasItem("search_products")))
                .andExpect(jsonPath("$.result.tools[*].name", hasItem("get_product")))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("tools/call computes a product footprint")
    void callsEmissionsTool() throws Exception {
        frame("co2", "{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"calculate_product_co2\",\"arguments\":{\"product_id\":\"OLJCESPC7Z\"}}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("a"))
                .andExpect(jsonPath("$.result.structuredContent.footprint_kg").value(closeTo(49.0, 1e-9)));
    }

    @Test
    @DisplayName("Errors travel inside the JSON-RPC envelope")
    void errorsStayInEnvelope() throws Exception {
        frame("co2", "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"calculate_shipping_co2\",\"arguments\":{\"method\":\"teleport\"}}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error.code").value(-32602));

        frame("co2", "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"sampling/create\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error.code").value(-32601));

        frame("co2", "{not json")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error.code").value(-32602));
    }

    @Test
    @DisplayName("Discovery returns the endpoint manifest")
    void discovery() throws Exception {
        mockMvc.perform(get("/mcp/{id}", "co2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpointId").value("co2"))
                .andExpect(jsonPath("$.tools[*].name", hasItem("shipping_options")))
                .andExpect(jsonPath("$.tools.length()").value(3));
    }

    @Test
    @DisplayName("Unknown endpoints are a 404 with NOT_FOUND")
    void unknownEndpoint() throws Exception {
        frame("weather", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value(-32601))
                .andExpect(jsonPath("$.error.message").value(containsString("weather")));

        mockMvc.perform(get("/mcp/{id}", "weather"))
                .andExpect(status().isNotFound());
    }
}
