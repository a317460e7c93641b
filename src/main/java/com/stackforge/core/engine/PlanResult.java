package com.stackforge.core.engine;

import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one plan run: a terminal result for every stack of
 * the execution graph, in execution order.
 *
 * @param runId      identifier of the run, also used as the MDC run id
 * @param operation  operation that was requested
 * @param results    per-stack results keyed by stack name
 * @param cancelled  whether cancellation was requested during the run
 * @param startedAt  when the run started
 * @param finishedAt when the last stack reached a terminal state
 */
public record PlanResult(
    String runId,
    Operation operation,
    Map<String, StackResult> results,
    boolean cancelled,
    Instant startedAt,
    Instant finishedAt
) {

    public PlanResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static PlanResult empty(String runId, Operation operation) {
        Instant now = Instant.now();
        return new PlanResult(runId, operation, Map.of(), false, now, now);
    }

    public boolean isSuccessful() {
        return results.values().stream().allMatch(StackResult::isSuccessful);
    }

    public StackResult result(String stackName) {
        return results.get(stackName);
    }

    public List<StackResult> failures() {
        return results.values().stream().filter(r -> !r.isSuccessful()).toList();
    }

    public List<StackResult> successes() {
        return results.values().stream().filter(StackResult::isSuccessful).toList();
    }

    public long count(FailureReason reason) {
        return results.values().stream().filter(r -> r.failureReason() == reason).count();
    }

    /**
     * Combines this result with a later run, as launch does after pruning.
     * Results of the later run win for stacks present in both.
     */
    public PlanResult merge(PlanResult later) {
        var merged = new LinkedHashMap<>(results);
        merged.putAll(later.results);
        return new PlanResult(runId, later.operation, merged, cancelled || later.cancelled,
                startedAt, later.finishedAt);
    }
}
