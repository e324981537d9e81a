package com.smurthy.ai.shopping.controllers;

import com.fasterxml.jackson.databind.node.NullNode;
import com.smurthy.ai.shopping.mcp.EndpointManifest;
import com.smurthy.ai.shopping.mcp.InProcessToolTransport;
import com.smurthy.ai.shopping.mcp.JsonRpcError;
import com.smurthy.ai.shopping.mcp.JsonRpcResponse;
import com.smurthy.ai.shopping.mcp.ToolEndpoint;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Exposes the in-process tool endpoints over HTTP, one JSON-RPC frame per POST.
 */
@RestController
@RequestMapping("/mcp")
class ToolTransportController {

    private static final Logger log = LoggerFactory.getLogger(ToolTransportController.class);

    private final InProcessToolTransport transport;

    public ToolTransportController(InProcessToolTransport transport) {
        this.transport = transport;
    }

    @PostMapping(value = "/{endpointId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> call(@PathVariable String endpointId, @RequestBody String frame) {
        Optional<ToolEndpoint> endpoint = transport.findEndpoint(endpointId);
        if (endpoint.isEmpty()) {
            log.warn("JSON-RPC frame for unknown endpoint {}", endpointId);
            return ResponseEntity.status(404).body(JsonRpcResponse.failure(NullNode.getInstance(),
                    JsonRpcError.of(ToolErrorCode.NOT_FOUND, "Endpoint '" + endpointId + "' not found")));
        }
        log.debug("JSON-RPC frame for {}: {}", endpointId, frame);
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(endpoint.get().handle(frame));
    }

    @GetMapping("/{endpointId}")
    public EndpointManifest manifest(@PathVariable String endpointId) {
        return transport.discover(endpointId);
    }
}
