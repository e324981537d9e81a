package com.smurthy.ai.shopping.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Message router settings: retry policy, deadlines, follow-up depth and fan-out pool size.
 */
@ConfigurationProperties(prefix = "shopping.router")
public record RouterProperties(
        @DefaultValue("2") int maxRetries,
        @DefaultValue("200ms") Duration initialBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("2s") Duration maxBackoff,
        @DefaultValue("5s") Duration defaultDeadline,
        @DefaultValue("3") int maxDepth,
        @DefaultValue("8") int parallelThreads
) {
    public static RouterProperties defaults() {
        return new RouterProperties(2, Duration.ofMillis(200), 2.0, Duration.ofSeconds(2),
                Duration.ofSeconds(5), 3, 8);
    }
}
