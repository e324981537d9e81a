package com.smurthy.ai.shopping.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.registry.HealthStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Body of {@code GET /health}. Status is "healthy" when every registered handler is healthy,
 * "degraded" when only some are, and "unhealthy" when none are.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthSummary(
        String status,
        Map<String, HealthStatus> agents,
        int healthyAgents,
        int totalAgents,
        int activeSessions,
        Map<String, Integer> toolEndpoints,
        Instant timestamp
) {
    public static String overallStatus(int healthy, int total) {
        if (total > 0 && healthy == total) {
            return "healthy";
        }
        return healthy > 0 ? "degraded" : "unhealthy";
    }
}
