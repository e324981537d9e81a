package com.smurthy.ai.shopping.registry;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One handler's answer to a broadcast probe.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BroadcastResult(String name, boolean success, String response, String error, long elapsedMs) {

    public static BroadcastResult ok(String name, String response, long elapsedMs) {
        return new BroadcastResult(name, true, response, null, elapsedMs);
    }

    public static BroadcastResult failed(String name, String error, long elapsedMs) {
        return new BroadcastResult(name, false, null, error, elapsedMs);
    }
}
