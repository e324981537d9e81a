package com.smurthy.ai.shopping.observability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.shopping.orchestration.HandlerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Operational counters for the assistant.
 *
 * Tracks, per handler, how many calls were made and how they ended (after retries), plus the
 * average time a call took. Tracks, per tool endpoint, how many JSON-RPC calls went through the
 * transport and how many of them failed.
 *
 * Usage:
 * 1. The handler invoker calls recordHandler() with every outcome it produces
 * 2. The tool transport calls recordToolCall() / recordToolError() around each frame
 * 3. Call getMetricsSummary() to get current statistics
 */
@Component
public class AssistantMetrics {

    private static final Logger log = LoggerFactory.getLogger(AssistantMetrics.class);

    private final Map<String, HandlerCounters> handlers = new ConcurrentHashMap<>();
    private final Map<String, EndpointCounters> endpoints = new ConcurrentHashMap<>();
    private final Clock clock;

    public AssistantMetrics(Clock clock) {
        this.clock = clock;
    }

    public void recordHandler(HandlerOutcome outcome) {
        HandlerCounters counters = handlers.computeIfAbsent(outcome.handlerName(), k -> new HandlerCounters());
        counters.requests.increment();
        counters.totalElapsedMs.add(outcome.elapsedMs());
        switch (outcome.status()) {
            case SUCCEEDED -> counters.succeeded.increment();
            case FAILED -> counters.failed.increment();
            case TIMED_OUT -> counters.timedOut.increment();
            case CANCELLED -> counters.cancelled.increment();
            case SKIPPED -> counters.skipped.increment();
        }
    }

    public void recordToolCall(String endpointId) {
        endpoints.computeIfAbsent(endpointId, k -> new EndpointCounters()).calls.increment();
    }

    public void recordToolError(String endpointId) {
        endpoints.computeIfAbsent(endpointId, k -> new EndpointCounters()).errors.increment();
    }

    public MetricsSummary getMetricsSummary() {
        Map<String, HandlerStats> handlerStats = new TreeMap<>();
        handlers.forEach((name, c) -> {
            long requests = c.requests.sum();
            handlerStats.put(name, new HandlerStats(requests, c.succeeded.sum(), c.failed.sum(), c.timedOut.sum(),
                    c.cancelled.sum(), requests > 0 ? c.totalElapsedMs.sum() / requests : 0));
        });
        Map<String, EndpointStats> endpointStats = new TreeMap<>();
        endpoints.forEach((id, c) -> endpointStats.put(id, new EndpointStats(c.calls.sum(), c.errors.sum())));
        return new MetricsSummary(handlerStats, endpointStats, clock.instant());
    }

    /**
     * Reset all counters
     */
    public void resetMetrics() {
        handlers.clear();
        endpoints.clear();
        log.info("Assistant metrics reset");
    }

    private static final class HandlerCounters {
        private final LongAdder requests = new LongAdder();
        private final LongAdder succeeded = new LongAdder();
        private final LongAdder failed = new LongAdder();
        private final LongAdder timedOut = new LongAdder();
        private final LongAdder cancelled = new LongAdder();
        private final LongAdder skipped = new LongAdder();
        private final LongAdder totalElapsedMs = new LongAdder();
    }

    private static final class EndpointCounters {
        private final LongAdder calls = new LongAdder();
        private final LongAdder errors = new LongAdder();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HandlerStats(
            long requestsProcessed,
            long successful,
            long failed,
            long timedOut,
            long cancelled,
            long averageResponseMs
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EndpointStats(long calls, long errors) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MetricsSummary(
            Map<String, HandlerStats> handlers,
            Map<String, EndpointStats> toolEndpoints,
            Instant timestamp
    ) {}
}
