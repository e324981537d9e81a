package com.smurthy.ai.shopping.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Body of {@code POST /send}: hands {@code task} straight to {@code agentName}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendRequest(String agentName, String task, String sessionId) {
}
