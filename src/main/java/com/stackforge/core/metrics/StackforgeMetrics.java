package com.stackforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan execution.
 */
@Service
public class StackforgeMetrics {

    private final MeterRegistry registry;

    public StackforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one stack operation ran.
     *
     * @param operation operation verb
     * @param outcome   "complete" or "failed"
     */
    public void recordStackOperation(String operation, String outcome, long ms) {
        Timer.builder("stackforge.stack.duration")
                .description("Duration of a single stack operation")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanResult(String operation, boolean successful) {
        Counter.builder("stackforge.plans.total")
                .tag("operation", operation)
                .tag("result", successful ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordPlanSize(int stacks) {
        DistributionSummary.builder("stackforge.plan.stacks")
                .description("Number of stacks per plan run")
                .register(registry)
                .record(stacks);
    }

    /**
     * Records a stack that never ran because a prerequisite failed or the run was cancelled.
     *
     * @param reason the failure reason, e.g. "upstream_failed"
     */
    public void recordSkippedStack(String reason) {
        Counter.builder("stackforge.stacks.skipped")
                .description("Stacks that never started")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
