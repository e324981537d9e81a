package com.smurthy.ai.shopping.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.agents.Intent;
import com.smurthy.ai.shopping.agents.WorkflowPattern;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.orchestration.AggregatedResult;
import com.smurthy.ai.shopping.session.SessionState;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a chat turn: the answer plus routing metadata and the session footprint
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatResponse(
        String response,
        String sessionId,
        Intent intent,
        WorkflowPattern workflow,
        List<String> handlers,
        List<String> degradedHandlers,
        List<String> failedHandlers,
        boolean partial,
        ErrorKind error,
        List<String> warnings,
        FootprintSummary footprint,
        Instant timestamp
) {
    public static ChatResponse from(AggregatedResult result, SessionState session, Instant timestamp) {
        return new ChatResponse(result.response(), session.sessionId(), result.intent(), result.workflow(),
                result.handlers(), result.degradedHandlers(), result.failedHandlers(), result.partial(),
                result.error(), result.warnings(), FootprintSummary.from(session), timestamp);
    }
}
