package com.smurthy.ai.shopping.agents;

import com.smurthy.ai.shopping.orchestration.CallContext;

import java.util.List;
import java.util.Optional;

/**
 * Everything a handler gets for one call: the task, the results of handlers that ran before it
 * in a sequential chain, and the call's deadline and cancellation signal.
 */
public record AgentRequest(TaskDescriptor task, List<AgentResult> priorResults, CallContext context) {

    public AgentRequest {
        priorResults = priorResults == null ? List.of() : List.copyOf(priorResults);
    }

    public static AgentRequest of(TaskDescriptor task) {
        return new AgentRequest(task, List.of(), CallContext.none());
    }

    /**
     * The most recent prior result carrying {@code key} in its data.
     */
    public Optional<Object> priorData(String key) {
        for (int i = priorResults.size() - 1; i >= 0; i--) {
            Object value = priorResults.get(i).data().get(key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public String sessionId() {
        return task.sessionId();
    }
}
