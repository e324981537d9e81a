package com.smurthy.ai.shopping.config;

import com.smurthy.ai.shopping.errors.ShoppingAssistantException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries only failures that declare themselves transient. Invalid parameters, bad session
 * state and timeouts surface on the first attempt.
 */
public class TransientFailureRetryPolicy extends SimpleRetryPolicy {

    public TransientFailureRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return true;
        }
        return last instanceof ShoppingAssistantException sae
                && sae.isTransient()
                && context.getRetryCount() < getMaxAttempts();
    }
}
