package com.smurthy.ai.shopping.agents;

import java.util.Set;

/**
 * A handler endpoint for one task domain.
 *
 * Agents may return a failed {@link AgentResult} for expected, non-retryable problems (an empty
 * cart at checkout). Anything thrown is classified by the router: transient failures are
 * retried, everything else is reported against the agent without retry.
 */
public interface ShoppingAgent {

    String name();

    String description();

    /**
     * Capability names this agent serves, matching {@link Intent#capability()}.
     */
    Set<String> capabilities();

    AgentResult handle(AgentRequest request);

    default boolean isAvailable() {
        return true;
    }

    /**
     * Answer to a registry broadcast.
     */
    default String healthCheck(String message) {
        return name() + " OK";
    }
}
