package com.smurthy.ai.shopping.errors;

public class HandlerUnavailableException extends ShoppingAssistantException {

    public HandlerUnavailableException(String handlerName) {
        super(ErrorKind.HANDLER_UNAVAILABLE, "Handler not registered: " + handlerName);
    }
}
