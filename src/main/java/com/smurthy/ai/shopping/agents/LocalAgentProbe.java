package com.smurthy.ai.shopping.agents;

import com.smurthy.ai.shopping.errors.HandlerUnavailableException;
import com.smurthy.ai.shopping.registry.HandlerProbe;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivers registry broadcasts to the agents running in this process.
 */
@Component
public class LocalAgentProbe implements HandlerProbe {

    private final Map<String, ShoppingAgent> agents;

    public LocalAgentProbe(List<ShoppingAgent> agents) {
        this.agents = agents.stream().collect(Collectors.toUnmodifiableMap(ShoppingAgent::name, Function.identity()));
    }

    @Override
    public String probe(String handlerName, String message) {
        ShoppingAgent agent = agents.get(handlerName);
        if (agent == null) {
            throw new HandlerUnavailableException(handlerName);
        }
        return agent.healthCheck(message);
    }
}
