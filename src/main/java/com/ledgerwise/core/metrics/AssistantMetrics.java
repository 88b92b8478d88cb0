package com.ledgerwise.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for request processing.
 */
@Service
public class AssistantMetrics {

    private final MeterRegistry registry;

    public AssistantMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String intent) {
        Counter.builder("ledgerwise.classifications.total")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    public void recordPlanSize(int steps) {
        DistributionSummary.builder("ledgerwise.plan.steps")
                .description("Steps per resolved plan")
                .register(registry)
                .record(steps);
    }

    /**
     * @param tool    tool name
     * @param outcome "succeeded" or the failure's error kind
     * @param ms      wall time including retries
     */
    public void recordStepExecution(String tool, String outcome, long ms) {
        Timer.builder("ledgerwise.step.duration")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String tool, String errorKind) {
        Counter.builder("ledgerwise.step.retries")
                .tag("tool", tool)
                .tag("error", errorKind)
                .register(registry)
                .increment();
    }

    public void recordRequestResult(String status) {
        Counter.builder("ledgerwise.requests.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRequestDuration(long ms) {
        Timer.builder("ledgerwise.request.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
