package com.smurthy.ai.shopping.errors;

public class RetryExhaustedException extends ShoppingAssistantException {

    private final int attempts;

    public RetryExhaustedException(String handlerName, int attempts, Throwable lastFailure) {
        super(ErrorKind.RETRY_EXHAUSTED,
                handlerName + " still failing after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
