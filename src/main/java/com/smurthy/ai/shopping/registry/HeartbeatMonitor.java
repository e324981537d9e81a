package com.smurthy.ai.shopping.registry;

import com.smurthy.ai.shopping.agents.ShoppingAgent;
import com.smurthy.ai.shopping.errors.HandlerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic health pass over the registry. Local handlers that report themselves available get
 * a heartbeat, the others are marked degraded, and any card whose last heartbeat is older than
 * {@code shopping.registry.staleness} becomes unreachable.
 */
@Component
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final CapabilityRegistry registry;
    private final List<ShoppingAgent> agents;

    public HeartbeatMonitor(CapabilityRegistry registry, List<ShoppingAgent> agents) {
        this.registry = registry;
        this.agents = agents;
    }

    @Scheduled(fixedDelayString = "${shopping.registry.heartbeat-interval-ms:10000}",
            initialDelayString = "${shopping.registry.heartbeat-interval-ms:10000}")
    public void checkHandlers() {
        for (ShoppingAgent agent : agents) {
            try {
                if (agent.isAvailable()) {
                    registry.heartbeat(agent.name());
                } else {
                    registry.markStatus(agent.name(), HealthStatus.DEGRADED);
                }
            } catch (HandlerUnavailableException e) {
                // unregistered through the API; stays out until registered again
                log.debug("Skipping heartbeat for {}: {}", agent.name(), e.getMessage());
            }
        }
        List<String> stale = registry.sweepStale();
        if (!stale.isEmpty()) {
            log.warn("Handlers without a recent heartbeat: {}", stale);
        }
    }
}
