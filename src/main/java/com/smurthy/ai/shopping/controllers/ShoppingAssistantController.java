package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.dto.ChatRequest;
import com.smurthy.ai.shopping.dto.ChatResponse;
import com.smurthy.ai.shopping.dto.HealthSummary;
import com.smurthy.ai.shopping.dto.SendRequest;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.HandlerUnavailableException;
import com.smurthy.ai.shopping.errors.ShoppingAssistantException;
import com.smurthy.ai.shopping.mcp.InProcessToolTransport;
import com.smurthy.ai.shopping.mcp.ToolEndpoint;
import com.smurthy.ai.shopping.orchestration.AggregatedResult;
import com.smurthy.ai.shopping.orchestration.MessageRouter;
import com.smurthy.ai.shopping.registry.CapabilityCard;
import com.smurthy.ai.shopping.registry.CapabilityRegistry;
import com.smurthy.ai.shopping.registry.HealthStatus;
import com.smurthy.ai.shopping.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for shoppers: natural-language chat, direct hand-off to a named handler,
 * and the service health summary.
 */
@RestController
public class ShoppingAssistantController {

    private static final Logger log = LoggerFactory.getLogger(ShoppingAssistantController.class);

    private final MessageRouter router;
    private final SessionStore sessionStore;
    private final CapabilityRegistry registry;
    private final InProcessToolTransport transport;
    private final Clock clock;

    public ShoppingAssistantController(MessageRouter router, SessionStore sessionStore, CapabilityRegistry registry,
                                       InProcessToolTransport transport, Clock clock) {
        this.router = router;
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.transport = transport;
        this.clock = clock;
    }

    /**
     * Classifies the message, runs the matching workflow and reports the session footprint.
     *
     * @param request message plus optional session id; a new session id is issued when absent
     */
    @PostMapping("/chat")
    public ChatResponse chat(@RequestBody ChatRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new ShoppingAssistantException(ErrorKind.INVALID_REQUEST, "message is required");
        }
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? newSessionId()
                : request.sessionId();
        log.info("Chat [{}]: '{}'", sessionId, request.message());

        AggregatedResult result = router.route(request.message(), sessionId);
        return ChatResponse.from(result, sessionStore.viewCart(sessionId), clock.instant());
    }

    @PostMapping("/send")
    public AggregatedResult send(@RequestBody SendRequest request) {
        if (request == null || request.agentName() == null || request.agentName().isBlank()
                || request.task() == null || request.task().isBlank()) {
            throw new ShoppingAssistantException(ErrorKind.INVALID_REQUEST, "agent_name and task are required");
        }
        if (registry.get(request.agentName()).isEmpty()) {
            throw new HandlerUnavailableException(request.agentName());
        }
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? newSessionId()
                : request.sessionId();
        log.info("Direct send to {} [{}]: '{}'", request.agentName(), sessionId, request.task());
        return router.send(request.agentName(), request.task(), sessionId);
    }

    @GetMapping("/health")
    public HealthSummary health() {
        List<CapabilityCard> cards = registry.list();
        Map<String, HealthStatus> agents = new LinkedHashMap<>();
        cards.forEach(c -> agents.put(c.name(), c.status()));
        int healthy = (int) cards.stream().filter(CapabilityCard::isHealthy).count();

        Map<String, Integer> endpoints = new LinkedHashMap<>();
        for (String id : transport.endpointIds()) {
            endpoints.put(id, transport.findEndpoint(id).map(ToolEndpoint::toolCount).orElse(0));
        }
        return new HealthSummary(HealthSummary.overallStatus(healthy, cards.size()), agents, healthy, cards.size(),
                sessionStore.activeSessionCount(), endpoints, clock.instant());
    }

    private static String newSessionId() {
        return "session-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
