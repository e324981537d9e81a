package com.smurthy.ai.shopping.registry;

import com.smurthy.ai.shopping.agents.ShoppingAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the in-process handlers at startup and sends their first heartbeat, so the
 * router can use them before the monitor's first sweep.
 */
@Component
public class AgentRegistrar implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistrar.class);

    private final CapabilityRegistry registry;
    private final List<ShoppingAgent> agents;

    public AgentRegistrar(CapabilityRegistry registry, List<ShoppingAgent> agents) {
        this.registry = registry;
        this.agents = agents;
    }

    @Override
    public void run(String... args) {
        registerAll();
    }

    public void registerAll() {
        log.info("Registering {} local handlers...", agents.size());
        for (ShoppingAgent agent : agents) {
            registry.register(CapabilityCard.of(agent.name(), agent.description(), agent.capabilities()));
            if (agent.isAvailable()) {
                registry.heartbeat(agent.name());
            }
        }
        log.info("Handler registration finished: {} healthy", registry.healthyCount());
    }
}
