package com.stackforge.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a plan runs, used for CLI progress output.
 *
 * @param eventType event type, e.g. "plan.started", "stack.completed"
 * @param runId     the plan run this event belongs to
 * @param stackName the stack this event relates to (nullable for plan-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record StackforgeEvent(
    String eventType,
    String runId,
    String stackName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String PLAN_STARTED = "plan.started";
    public static final String PLAN_COMPLETED = "plan.completed";
    public static final String STACK_STARTED = "stack.started";
    public static final String STACK_COMPLETED = "stack.completed";
    public static final String STACK_FAILED = "stack.failed";
    public static final String STACK_SKIPPED = "stack.skipped";

    public static StackforgeEvent of(String eventType, String runId, String stackName, Map<String, Object> payload) {
        return new StackforgeEvent(eventType, runId, stackName, payload, Instant.now());
    }
}
