package com.smurthy.ai.shopping.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.agents.Intent;
import com.smurthy.ai.shopping.agents.WorkflowPattern;
import com.smurthy.ai.shopping.errors.ErrorKind;

import java.util.List;

/**
 * What the router hands back for one dispatched task: the combined answer plus every handler's
 * outcome. Routing and handler failures are reported here, never thrown.
 *
 * @param partial          true when at least one handler did not succeed
 * @param degradedHandlers handlers that ran out of time on this call
 * @param failedHandlers   handlers that failed, were cancelled, or were never reached
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregatedResult(
        String taskId,
        Intent intent,
        WorkflowPattern workflow,
        String response,
        List<HandlerOutcome> outcomes,
        boolean partial,
        List<String> degradedHandlers,
        List<String> failedHandlers,
        ErrorKind error,
        List<String> warnings
) {
    public AggregatedResult {
        outcomes = List.copyOf(outcomes);
        degradedHandlers = List.copyOf(degradedHandlers);
        failedHandlers = List.copyOf(failedHandlers);
        warnings = List.copyOf(warnings);
    }

    @JsonIgnore
    public List<AgentResult> successfulResults() {
        return outcomes.stream().filter(HandlerOutcome::isSuccess).map(HandlerOutcome::result).toList();
    }

    @JsonIgnore
    public List<String> handlers() {
        return outcomes.stream().map(HandlerOutcome::handlerName).toList();
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
