package com.smurthy.ai.shopping.session;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One cart line. {@code itemId} is the line key; lines for the same product share it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CartItem(
        String itemId,
        String productId,
        String name,
        double unitPriceUsd,
        int quantity,
        double footprintKgPerUnit
) {
    public CartItem {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        if (!Double.isFinite(footprintKgPerUnit) || footprintKgPerUnit < 0) {
            throw new IllegalArgumentException("footprint must be a non-negative number: " + footprintKgPerUnit);
        }
        if (!Double.isFinite(unitPriceUsd) || unitPriceUsd < 0) {
            throw new IllegalArgumentException("price must be a non-negative number: " + unitPriceUsd);
        }
    }

    public static CartItem of(String productId, String name, double unitPriceUsd, int quantity, double footprintKgPerUnit) {
        return new CartItem(productId, productId, name, unitPriceUsd, quantity, footprintKgPerUnit);
    }

    public double lineFootprintKg() {
        return footprintKgPerUnit * quantity;
    }

    public double linePriceUsd() {
        return unitPriceUsd * quantity;
    }

    public CartItem withQuantity(int newQuantity) {
        return new CartItem(itemId, productId, name, unitPriceUsd, newQuantity, footprintKgPerUnit);
    }
}
