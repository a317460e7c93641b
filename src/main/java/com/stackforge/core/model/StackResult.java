package com.stackforge.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal outcome of one stack within a plan run.
 *
 * @param stackName     identity of the stack
 * @param operation     operation that was requested
 * @param state         {@link NodeState#COMPLETE} or {@link NodeState#FAILED}
 * @param status        simplified provider status (null when the stack never ran)
 * @param output        operation output such as a description or outputs map (nullable)
 * @param failureReason why the stack failed (null when complete)
 * @param message       human-readable cause of the failure (null when complete)
 * @param startedAt     when the operation started (null when it never ran)
 * @param finishedAt    when the stack reached its terminal state
 */
public record StackResult(
    String stackName,
    Operation operation,
    NodeState state,
    StackStatus status,
    Object output,
    FailureReason failureReason,
    String message,
    Instant startedAt,
    Instant finishedAt
) {

    public static StackResult complete(String stackName, Operation operation, StackStatus status,
                                       Object output, Instant startedAt, Instant finishedAt) {
        return new StackResult(stackName, operation, NodeState.COMPLETE, status, output,
                null, null, startedAt, finishedAt);
    }

    public static StackResult failed(String stackName, Operation operation, FailureReason reason,
                                     String message, Instant startedAt, Instant finishedAt) {
        return new StackResult(stackName, operation, NodeState.FAILED, StackStatus.FAILED, null,
                reason, message, startedAt, finishedAt);
    }

    public static StackResult upstreamFailed(String stackName, Operation operation, String failedPrerequisite) {
        return new StackResult(stackName, operation, NodeState.FAILED, null, null,
                FailureReason.UPSTREAM_FAILED,
                "Upstream dependency '" + failedPrerequisite + "' failed",
                null, Instant.now());
    }

    public static StackResult cancelled(String stackName, Operation operation) {
        return new StackResult(stackName, operation, NodeState.FAILED, null, null,
                FailureReason.CANCELLED, "Run was cancelled before the stack started",
                null, Instant.now());
    }

    public boolean isSuccessful() {
        return state == NodeState.COMPLETE;
    }

    /** True when the stack's own operation was started. */
    public boolean hasRun() {
        return startedAt != null;
    }

    public long durationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
