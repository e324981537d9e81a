package com.smurthy.ai.shopping.service;

/**
 * Opaque payment result. Only {@code approved} drives the session state machine.
 */
public record PaymentOutcome(boolean approved, String reference, String message) {

    public static PaymentOutcome approved(String reference) {
        return new PaymentOutcome(true, reference, "approved");
    }

    public static PaymentOutcome declined(String message) {
        return new PaymentOutcome(false, null, message);
    }
}
