package com.stackforge.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StackforgeMetricsTest {

    private SimpleMeterRegistry registry;
    private StackforgeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StackforgeMetrics(registry);
    }

    @Test
    @DisplayName("recordStackOperation records by operation and outcome")
    void recordStackOperation() {
        metrics.recordStackOperation("launch", "complete", 200);
        metrics.recordStackOperation("launch", "complete", 300);
        metrics.recordStackOperation("launch", "failed", 100);

        var complete = registry.find("stackforge.stack.duration")
                .tag("operation", "launch").tag("outcome", "complete").timer();
        var failed = registry.find("stackforge.stack.duration")
                .tag("operation", "launch").tag("outcome", "failed").timer();

        assertNotNull(complete);
        assertNotNull(failed);
        assertEquals(2, complete.count());
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("recordPlanResult increments correct counter")
    void recordPlanResult() {
        metrics.recordPlanResult("delete", true);
        metrics.recordPlanResult("delete", false);
        metrics.recordPlanResult("delete", false);

        var success = registry.find("stackforge.plans.total").tag("result", "success").counter();
        var failure = registry.find("stackforge.plans.total").tag("result", "failure").counter();

        assertNotNull(success);
        assertNotNull(failure);
        assertEquals(1.0, success.count());
        assertEquals(2.0, failure.count());
    }

    @Test
    @DisplayName("recordPlanSize creates a distribution summary")
    void recordPlanSize() {
        metrics.recordPlanSize(3);
        metrics.recordPlanSize(5);

        var summary = registry.find("stackforge.plan.stacks").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(8.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordSkippedStack counts by reason")
    void recordSkippedStack() {
        metrics.recordSkippedStack("upstream_failed");
        metrics.recordSkippedStack("upstream_failed");
        metrics.recordSkippedStack("cancelled");

        assertEquals(2.0, registry.find("stackforge.stacks.skipped").tag("reason", "upstream_failed").counter().count());
        assertEquals(1.0, registry.find("stackforge.stacks.skipped").tag("reason", "cancelled").counter().count());
    }
}
