package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.errors.ErrorKind;

import java.util.List;
import java.util.Map;

/**
 * Result returned by a specialized agent after execution
 *
 * @param data      structured output later handlers in a sequential chain can build on
 * @param followUps work the agent wants the router to dispatch next (hierarchical workflow)
 * @param errorKind set only when {@code success} is false
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentResult(
        String agentName,
        String result,
        boolean success,
        long executionTimeMs,
        Map<String, Object> data,
        List<FollowUp> followUps,
        ErrorKind errorKind
) {
    public AgentResult {
        data = data == null ? Map.of() : Map.copyOf(data);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }

    public static AgentResult success(String agentName, String result, long executionTimeMs) {
        return new AgentResult(agentName, result, true, executionTimeMs, Map.of(), List.of(), null);
    }

    public static AgentResult success(String agentName, String result, long executionTimeMs, Map<String, Object> data) {
        return new AgentResult(agentName, result, true, executionTimeMs, data, List.of(), null);
    }

    public static AgentResult failure(String agentName, String errorMessage, long executionTimeMs, ErrorKind kind) {
        return new AgentResult(agentName, errorMessage, false, executionTimeMs, Map.of(), List.of(), kind);
    }

    public AgentResult withFollowUps(List<FollowUp> next) {
        return new AgentResult(agentName, result, success, executionTimeMs, data, next, errorKind);
    }

    @JsonIgnore
    public boolean needsFollowUp() {
        return success && !followUps.isEmpty();
    }
}
