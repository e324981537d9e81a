package com.smurthy.ai.shopping.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.errors.InvalidSessionStateException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one shopping session.
 *
 * The total footprint is derived from its two components on every read, so it cannot
 * drift from them. The product component is always recomputed from the cart lines, and
 * the shipping component is replaced wholesale on each selection.
 *
 * Transition methods validate their precondition and return a new snapshot, or throw
 * {@link InvalidSessionStateException} without producing one.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionState(
        String sessionId,
        List<CartItem> cartItems,
        double productFootprintKg,
        double shippingFootprintKg,
        String selectedShippingMethod,
        Lifecycle lifecycle,
        Instant lastUpdated
) {
    public SessionState {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(lifecycle, "lifecycle");
        cartItems = List.copyOf(cartItems);
    }

    public static SessionState empty(String sessionId, Instant now) {
        return new SessionState(sessionId, List.of(), 0.0, 0.0, null, Lifecycle.ACTIVE, now);
    }

    @JsonProperty("total_footprint_kg")
    public double totalFootprintKg() {
        return productFootprintKg + shippingFootprintKg;
    }

    @JsonProperty("item_count")
    public int itemCount() {
        return cartItems.stream().mapToInt(CartItem::quantity).sum();
    }

    @JsonProperty("subtotal_usd")
    public double subtotalUsd() {
        return cartItems.stream().mapToDouble(CartItem::linePriceUsd).sum();
    }

    @JsonProperty("eco_rating")
    public String ecoRating() {
        return EcoRating.of(totalFootprintKg()).label();
    }

    @JsonIgnore
    public boolean isCartEmpty() {
        return cartItems.isEmpty();
    }

    SessionState addItem(CartItem item, Instant now) {
        requireLifecycle(Lifecycle.ACTIVE, "add items to the cart");
        List<CartItem> next = new ArrayList<>(cartItems.size() + 1);
        boolean merged = false;
        for (CartItem existing : cartItems) {
            if (existing.itemId().equals(item.itemId())) {
                next.add(existing.withQuantity(existing.quantity() + item.quantity()));
                merged = true;
            } else {
                next.add(existing);
            }
        }
        if (!merged) {
            next.add(item);
        }
        return withCart(next, now);
    }

    SessionState removeItem(String itemId, Instant now) {
        requireLifecycle(Lifecycle.ACTIVE, "remove items from the cart");
        List<CartItem> next = cartItems.stream()
                .filter(line -> !line.itemId().equals(itemId))
                .toList();
        if (next.size() == cartItems.size()) {
            return this;
        }
        return withCart(next, now);
    }

    SessionState withShipping(String method, double kg, Instant now) {
        if (lifecycle != Lifecycle.ACTIVE && lifecycle != Lifecycle.CHECKOUT) {
            throw invalid("select shipping");
        }
        if (cartItems.isEmpty()) {
            throw new InvalidSessionStateException(sessionId, lifecycle,
                    "Cannot select shipping for an empty cart");
        }
        if (!Double.isFinite(kg) || kg < 0) {
            throw new IllegalArgumentException("shipping footprint must be a non-negative number: " + kg);
        }
        return new SessionState(sessionId, cartItems, productFootprintKg, kg, method, lifecycle, now);
    }

    SessionState beginCheckout(Instant now) {
        requireLifecycle(Lifecycle.ACTIVE, "check out");
        if (cartItems.isEmpty()) {
            throw new InvalidSessionStateException(sessionId, lifecycle, "Cannot check out an empty cart");
        }
        return transition(Lifecycle.CHECKOUT, now);
    }

    SessionState complete(Instant now) {
        requireLifecycle(Lifecycle.CHECKOUT, "complete payment");
        return transition(Lifecycle.COMPLETED, now);
    }

    SessionState reset(Instant now) {
        if (!lifecycle.canTransitionTo(Lifecycle.ACTIVE)) {
            throw invalid("reset");
        }
        return empty(sessionId, now);
    }

    SessionState clear(Instant now) {
        requireLifecycle(Lifecycle.ACTIVE, "clear the cart");
        return empty(sessionId, now);
    }

    private SessionState withCart(List<CartItem> lines, Instant now) {
        if (lines.isEmpty()) {
            // nothing left to ship
            return new SessionState(sessionId, List.of(), 0.0, 0.0, null, lifecycle, now);
        }
        return new SessionState(sessionId, lines, footprintOf(lines), shippingFootprintKg,
                selectedShippingMethod, lifecycle, now);
    }

    private SessionState transition(Lifecycle next, Instant now) {
        if (!lifecycle.canTransitionTo(next)) {
            throw invalid("move to " + next);
        }
        return new SessionState(sessionId, cartItems, productFootprintKg, shippingFootprintKg,
                selectedShippingMethod, next, now);
    }

    private void requireLifecycle(Lifecycle expected, String action) {
        if (lifecycle != expected) {
            throw invalid(action);
        }
    }

    private InvalidSessionStateException invalid(String action) {
        return new InvalidSessionStateException(sessionId, lifecycle,
                "Cannot " + action + " while session is " + lifecycle);
    }

    static double footprintOf(List<CartItem> lines) {
        double sum = 0.0;
        for (CartItem line : lines) {
            sum += line.lineFootprintKg();
        }
        return sum;
    }
}
