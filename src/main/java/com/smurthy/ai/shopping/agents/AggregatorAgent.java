package com.smurthy.ai.shopping.agents;

import com.smurthy.ai.shopping.orchestration.HandlerOutcome;
import com.smurthy.ai.shopping.orchestration.OutcomeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregator Agent
 *
 * Combines the outcomes of every handler that worked on a task into one answer for the shopper.
 * Successful results are joined in dispatch order; handlers that failed or ran out of time are
 * acknowledged briefly without hiding what the others found.
 */
@Component
public class AggregatorAgent {

    private static final Logger log = LoggerFactory.getLogger(AggregatorAgent.class);

    /**
     * Synthesize handler outcomes into a unified answer
     *
     * @param task     the task the outcomes belong to
     * @param outcomes outcomes in dispatch order
     * @return text for the shopper
     */
    public String synthesize(TaskDescriptor task, List<HandlerOutcome> outcomes) {
        log.debug("[AggregatorAgent] Synthesizing {} outcomes for {}", outcomes.size(), task.id());

        List<HandlerOutcome> succeeded = outcomes.stream().filter(HandlerOutcome::isSuccess).toList();
        List<HandlerOutcome> missing = outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.FAILED || o.status() == OutcomeStatus.TIMED_OUT
                        || o.status() == OutcomeStatus.CANCELLED)
                .toList();

        if (succeeded.isEmpty()) {
            if (missing.isEmpty()) {
                return "I couldn't process your request. No handler was able to help.";
            }
            HandlerOutcome first = missing.get(0);
            return switch (first.status()) {
                case TIMED_OUT -> "Sorry, that took too long. Please try again.";
                case CANCELLED -> "Your request was cancelled.";
                default -> "I couldn't complete that: " + first.message();
            };
        }

        // If only one handler answered and nothing went wrong, return its result directly
        if (succeeded.size() == 1 && missing.isEmpty()) {
            return succeeded.get(0).result().result();
        }

        String combined = succeeded.stream()
                .map(o -> o.result().result())
                .collect(Collectors.joining("\n\n"));
        if (missing.isEmpty()) {
            return combined;
        }
        String note = missing.stream()
                .map(o -> o.handlerName() + (o.status() == OutcomeStatus.TIMED_OUT ? " didn't respond in time" : " was unavailable"))
                .collect(Collectors.joining("; "));
        return combined + "\n\n(Some information is missing: " + note + ".)";
    }
}
