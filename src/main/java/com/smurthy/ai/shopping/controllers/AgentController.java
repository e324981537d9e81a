package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.dto.AgentRegistrationRequest;
import com.smurthy.ai.shopping.dto.BroadcastRequest;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.HandlerUnavailableException;
import com.smurthy.ai.shopping.errors.ShoppingAssistantException;
import com.smurthy.ai.shopping.registry.BroadcastResult;
import com.smurthy.ai.shopping.registry.CapabilityCard;
import com.smurthy.ai.shopping.registry.CapabilityRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability registry endpoints
 */
@RestController
class AgentController {

    private final CapabilityRegistry registry;

    public AgentController(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/agents")
    public List<CapabilityCard> listAgents() {
        return registry.list();
    }

    @GetMapping("/agents/{name}/status")
    public CapabilityCard status(@PathVariable String name) {
        return registry.get(name).orElseThrow(() -> new HandlerUnavailableException(name));
    }

    @PostMapping("/agents/register")
    @ResponseStatus(HttpStatus.CREATED)
    public CapabilityCard register(@RequestBody AgentRegistrationRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ShoppingAssistantException(ErrorKind.INVALID_REQUEST, "name is required");
        }
        return registry.register(CapabilityCard.of(request.name(), request.description(), request.capabilities()));
    }

    @PostMapping("/agents/{name}/heartbeat")
    public CapabilityCard heartbeat(@PathVariable String name) {
        return registry.heartbeat(name);
    }

    @PostMapping("/broadcast")
    public Map<String, BroadcastResult> broadcast(@RequestBody BroadcastRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new ShoppingAssistantException(ErrorKind.INVALID_REQUEST, "message is required");
        }
        Set<String> exclude = request.exclude() == null ? Set.of() : new HashSet<>(request.exclude());
        return registry.broadcast(request.message(), exclude);
    }
}
