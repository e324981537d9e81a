package com.smurthy.ai.shopping.controllers;

import com.smurthy.ai.shopping.observability.AssistantMetrics;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/metrics")
class MonitoringController {

    private final AssistantMetrics metrics;

    public MonitoringController(AssistantMetrics metrics) {
        this.metrics = metrics;
    }

    @GetMapping
    public AssistantMetrics.MetricsSummary getMetrics() {
        return metrics.getMetricsSummary();
    }

    @PostMapping("/reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetMetrics() {
        metrics.resetMetrics();
    }
}
