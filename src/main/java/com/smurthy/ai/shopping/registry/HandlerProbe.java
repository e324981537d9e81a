package com.smurthy.ai.shopping.registry;

/**
 * Delivers a broadcast message to one named handler and returns its reply.
 */
@FunctionalInterface
public interface HandlerProbe {

    String probe(String handlerName, String message);
}
