package com.smurthy.ai.shopping.service;

import com.smurthy.ai.shopping.config.EmissionsProperties;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Footprint estimates from fixed emission factors.
 *
 * Products: {@code base * clamp((ceiling - price) / ceiling, minFactor, 1.0)}, rounded to 0.01 kg.
 * Shipping: {@code distance * kgPerMile} for the method.
 */
@Service
public class FactorEmissionsDataProvider implements EmissionsDataProvider {

    private record Method(String name, double costUsd, double kgPerMile, String ecoRating, String deliveryDays) {}

    private static final Map<String, Method> METHODS = Map.of(
            "eco", new Method("Eco-Friendly Shipping", 7.99, 0.3, "Very Low", "4-6"),
            "ground", new Method("Ground Shipping", 5.99, 0.5, "Low", "3-5"),
            "express", new Method("Express Shipping", 12.99, 2.0, "High", "1-2")
    );

    private final EmissionsProperties properties;

    public FactorEmissionsDataProvider(EmissionsProperties properties) {
        this.properties = properties;
    }

    @Override
    public double productFootprintKg(Product product) {
        double ceiling = properties.priceCeilingUsd();
        double factor = Math.max(properties.minProductFactor(),
                Math.min(1.0, (ceiling - product.priceUsd()) / ceiling));
        return round(properties.baseProductKg() * factor);
    }

    @Override
    public double shippingFootprintKg(String method) {
        Method m = METHODS.get(normalize(method));
        if (m == null) {
            throw new IllegalArgumentException("Unknown shipping method: " + method
                    + " (expected one of " + METHODS.keySet() + ")");
        }
        return round(properties.shippingDistanceMiles() * m.kgPerMile());
    }

    @Override
    public List<ShippingOption> shippingOptions() {
        return METHODS.entrySet().stream()
                .map(e -> new ShippingOption(e.getKey(), e.getValue().name(), e.getValue().costUsd(),
                        shippingFootprintKg(e.getKey()), e.getValue().ecoRating(), e.getValue().deliveryDays()))
                .sorted(Comparator.comparingDouble(ShippingOption::footprintKg))
                .toList();
    }

    private static String normalize(String method) {
        return method == null ? "" : method.trim().toLowerCase(Locale.ROOT);
    }

    private static double round(double kg) {
        return BigDecimal.valueOf(kg).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
