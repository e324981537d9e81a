package com.smurthy.ai.shopping.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Emission factors used by the footprint provider
 */
@ConfigurationProperties(prefix = "shopping.emissions")
public record EmissionsProperties(
        @DefaultValue("50.0") double baseProductKg,
        @DefaultValue("1000.0") double priceCeilingUsd,
        @DefaultValue("0.1") double minProductFactor,
        @DefaultValue("500") double shippingDistanceMiles
) {
    public static EmissionsProperties defaults() {
        return new EmissionsProperties(50.0, 1000.0, 0.1, 500);
    }
}
