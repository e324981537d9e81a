package com.smurthy.ai.shopping.registry;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Set;

/**
 * Published identity of a handler: what it can do and how healthy it was at its last heartbeat.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CapabilityCard(
        String name,
        String description,
        Set<String> capabilities,
        HealthStatus status,
        Instant lastHeartbeat
) {
    public CapabilityCard {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability card needs a name");
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        status = status == null ? HealthStatus.UNKNOWN : status;
    }

    public static CapabilityCard of(String name, String description, Set<String> capabilities) {
        return new CapabilityCard(name, description, capabilities, HealthStatus.UNKNOWN, null);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    CapabilityCard withStatus(HealthStatus newStatus) {
        return new CapabilityCard(name, description, capabilities, newStatus, lastHeartbeat);
    }

    CapabilityCard withHeartbeat(Instant at) {
        return new CapabilityCard(name, description, capabilities, HealthStatus.HEALTHY, at);
    }
}
