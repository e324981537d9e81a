package com.smurthy.ai.shopping.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Session store settings
 */
@ConfigurationProperties(prefix = "shopping.session")
public record SessionProperties(
        @DefaultValue("2h") Duration idleTtl,
        @DefaultValue("128") int operationHistory
) {
    public static SessionProperties defaults() {
        return new SessionProperties(Duration.ofHours(2), 128);
    }
}
