package com.smurthy.ai.shopping.errors;

/**
 * A handler failure that is expected to clear up on its own (a collaborator was briefly
 * unavailable, a lock was contended, etc.).
 */
public class TransientHandlerException extends ShoppingAssistantException {

    public TransientHandlerException(String message) {
        super(ErrorKind.HANDLER_UNAVAILABLE, message);
    }

    public TransientHandlerException(String message, Throwable cause) {
        super(ErrorKind.HANDLER_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
