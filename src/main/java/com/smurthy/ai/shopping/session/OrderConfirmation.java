package com.smurthy.ai.shopping.session;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * What a session looked like at the moment its payment went through.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderConfirmation(
        String orderId,
        String sessionId,
        List<CartItem> items,
        double subtotalUsd,
        double productFootprintKg,
        double shippingFootprintKg,
        double totalFootprintKg,
        String shippingMethod,
        String paymentReference,
        Instant placedAt
) {
    public OrderConfirmation {
        items = List.copyOf(items);
    }

    static OrderConfirmation from(String orderId, SessionState completed, String paymentReference, Instant now) {
        return new OrderConfirmation(
                orderId,
                completed.sessionId(),
                completed.cartItems(),
                completed.subtotalUsd(),
                completed.productFootprintKg(),
                completed.shippingFootprintKg(),
                completed.totalFootprintKg(),
                completed.selectedShippingMethod(),
                paymentReference,
                now
        );
    }
}
