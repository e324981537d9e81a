package com.smurthy.ai.shopping.session;

/**
 * Shopping session lifecycle. The only legal edges are
 * {@code ACTIVE -> CHECKOUT -> COMPLETED -> ACTIVE}.
 */
public enum Lifecycle {
    ACTIVE,
    CHECKOUT,
    COMPLETED;

    public boolean canTransitionTo(Lifecycle next) {
        return switch (this) {
            case ACTIVE -> next == CHECKOUT;
            case CHECKOUT -> next == COMPLETED;
            case COMPLETED -> next == ACTIVE;
        };
    }
}
