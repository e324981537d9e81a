package com.smurthy.ai.shopping.errors;

import com.smurthy.ai.shopping.session.Lifecycle;

/**
 * Raised when a session operation's precondition does not hold. The session is left untouched.
 */
public class InvalidSessionStateException extends ShoppingAssistantException {

    private final String sessionId;
    private final Lifecycle lifecycle;

    public InvalidSessionStateException(String sessionId, Lifecycle lifecycle, String message) {
        super(ErrorKind.INVALID_SESSION_STATE, message);
        this.sessionId = sessionId;
        this.lifecycle = lifecycle;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }
}
