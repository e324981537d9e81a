package com.smurthy.ai.shopping.registry;

public enum HealthStatus {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    UNREACHABLE
}
