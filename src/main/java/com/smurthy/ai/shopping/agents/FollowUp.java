package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * A handler's request for more work after its own result. {@code handlerName} may be null,
 * in which case the router picks a capable handler for the intent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FollowUp(Intent intent, String handlerName, Map<String, Object> parameters, String reason) {

    public FollowUp {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static FollowUp of(Intent intent, String handlerName, String reason) {
        return new FollowUp(intent, handlerName, Map.of(), reason);
    }
}
