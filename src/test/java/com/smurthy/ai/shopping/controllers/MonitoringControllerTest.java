package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.BaseIntegrationTest;
import com.smurthy.ai.shopping.agents.GeneralAssistantAgent;
import com.smurthy.ai.shopping.agents.ProductDiscoveryAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MonitoringControllerTest extends BaseIntegrationTest {

    @Test
    @DisplayName("Handled chats show up in the per-handler counters")
    void countsHandledChats() throws Exception {
        chat(newSessionId(), "asdkjh").andExpect(status().isOk());

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handlers." + GeneralAssistantAgent.NAME + ".requests_processed")
                        .value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.handlers." + GeneralAssistantAgent.NAME + ".successful")
                        .value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.handlers." + GeneralAssistantAgent.NAME + ".average_response_ms").exists())
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Tool calls made while searching are counted per endpoint")
    void countsToolCalls() throws Exception {
        chat(newSessionId(), "find eco-friendly kitchen items under $20").andExpect(status().isOk());

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handlers." + ProductDiscoveryAgent.NAME + ".requests_processed")
                        .value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.tool_endpoints.boutique.calls").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.tool_endpoints.boutique.errors").exists());
    }
}
