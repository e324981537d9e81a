package com.smurthy.ai.shopping.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.session.SessionState;

/**
 * Session footprint as reported alongside every chat answer.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FootprintSummary(
        double productKg,
        double shippingKg,
        double totalKg,
        String shippingMethod,
        String ecoRating,
        int itemCount,
        String lifecycle
) {
    public static FootprintSummary from(SessionState state) {
        return new FootprintSummary(state.productFootprintKg(), state.shippingFootprintKg(), state.totalFootprintKg(),
                state.selectedShippingMethod(), state.ecoRating(), state.itemCount(), state.lifecycle().name());
    }
}
