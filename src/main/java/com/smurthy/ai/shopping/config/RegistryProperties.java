package com.smurthy.ai.shopping.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Capability registry settings
 */
@ConfigurationProperties(prefix = "shopping.registry")
public record RegistryProperties(
        @DefaultValue("30s") Duration staleness,
        @DefaultValue("10000") long heartbeatIntervalMs
) {
    public static RegistryProperties defaults() {
        return new RegistryProperties(Duration.ofSeconds(30), 10000);
    }
}
