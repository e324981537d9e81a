package com.smurthy.ai.shopping.orchestration;

/**
 * Deadline and cancellation signal carried into tool invocations and session mutations.
 */
public record CallContext(Deadline deadline, CancellationToken cancellationToken) {

    public static CallContext none() {
        return new CallContext(Deadline.none(), CancellationToken.create());
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public boolean isExpired() {
        return deadline.isExpired();
    }
}
