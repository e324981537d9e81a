package com.smurthy.ai.shopping.errors;

/**
 * The call's deadline passed before the handler produced a result. Never retried.
 */
public class HandlerTimeoutException extends ShoppingAssistantException {

    public HandlerTimeoutException(String message) {
        super(ErrorKind.HANDLER_TIMEOUT, message);
    }
}
