package com.smurthy.ai.shopping.orchestration;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.errors.ErrorKind;

/**
 * How one handler call went, after retries.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HandlerOutcome(
        String handlerName,
        OutcomeStatus status,
        AgentResult result,
        ErrorKind errorKind,
        String message,
        int attempts,
        long elapsedMs
) {
    public static HandlerOutcome succeeded(String handlerName, AgentResult result, int attempts, long elapsedMs) {
        return new HandlerOutcome(handlerName, OutcomeStatus.SUCCEEDED, result, null, null, attempts, elapsedMs);
    }

    public static HandlerOutcome failed(String handlerName, ErrorKind kind, String message, int attempts, long elapsedMs) {
        return new HandlerOutcome(handlerName, OutcomeStatus.FAILED, null, kind, message, attempts, elapsedMs);
    }

    public static HandlerOutcome timedOut(String handlerName, int attempts, long elapsedMs) {
        return new HandlerOutcome(handlerName, OutcomeStatus.TIMED_OUT, null, ErrorKind.HANDLER_TIMEOUT,
                handlerName + " did not answer before the deadline", attempts, elapsedMs);
    }

    public static HandlerOutcome cancelled(String handlerName, String reason, int attempts, long elapsedMs) {
        return new HandlerOutcome(handlerName, OutcomeStatus.CANCELLED, null, null, reason, attempts, elapsedMs);
    }

    public static HandlerOutcome skipped(String handlerName, String reason) {
        return new HandlerOutcome(handlerName, OutcomeStatus.SKIPPED, null, null, reason, 0, 0);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
