package com.smurthy.ai.shopping.errors;

/**
 * Base runtime exception for the assistant. Every failure carries its {@link ErrorKind}
 * and whether the router may retry it.
 */
public class ShoppingAssistantException extends RuntimeException {

    private final ErrorKind kind;

    public ShoppingAssistantException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ShoppingAssistantException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Transient failures are retried by the router; everything else surfaces immediately.
     */
    public boolean isTransient() {
        return false;
    }
}
