package com.ledgerwise.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AssistantMetricsTest {

    private SimpleMeterRegistry registry;
    private AssistantMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AssistantMetrics(registry);
    }

    @Test
    @DisplayName("recordClassification counts by intent")
    void recordClassification() {
        metrics.recordClassification("DATA_QUERY");
        metrics.recordClassification("DATA_QUERY");

        var counter = registry.find("ledgerwise.classifications.total").tag("intent", "DATA_QUERY").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("recordPlanSize records to a distribution summary")
    void recordPlanSize() {
        metrics.recordPlanSize(2);
        metrics.recordPlanSize(4);

        var summary = registry.find("ledgerwise.plan.steps").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(6.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordStepExecution times by tool and outcome")
    void recordStepExecution() {
        metrics.recordStepExecution("employee_lookup", "succeeded", 40);
        metrics.recordStepExecution("send_email", "TRANSIENT", 900);

        var lookup = registry.find("ledgerwise.step.duration")
                .tag("tool", "employee_lookup").tag("outcome", "succeeded").timer();
        var email = registry.find("ledgerwise.step.duration")
                .tag("tool", "send_email").tag("outcome", "TRANSIENT").timer();
        assertNotNull(lookup);
        assertNotNull(email);
        assertEquals(1, lookup.count());
    }

    @Test
    @DisplayName("recordRetry counts by tool and error kind")
    void recordRetry() {
        metrics.recordRetry("employee_lookup", "TRANSIENT");

        var counter = registry.find("ledgerwise.step.retries")
                .tag("tool", "employee_lookup").tag("error", "TRANSIENT").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("request results and durations are recorded")
    void requests() {
        metrics.recordRequestResult("DONE");
        metrics.recordRequestResult("REJECTED");
        metrics.recordRequestDuration(1200);

        assertEquals(1.0, registry.find("ledgerwise.requests.total").tag("status", "DONE").counter().count());
        assertEquals(1.0, registry.find("ledgerwise.requests.total").tag("status", "REJECTED").counter().count());
        assertEquals(1, registry.find("ledgerwise.request.duration").timer().count());
    }
}
