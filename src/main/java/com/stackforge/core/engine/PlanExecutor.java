package com.stackforge.core.engine;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.events.StackforgeEvent;
import com.stackforge.core.graph.ExecutionGraph;
import com.stackforge.core.logging.MdcContext;
import com.stackforge.core.metrics.StackforgeMetrics;
import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.NodeState;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.model.StackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an operation over an {@link ExecutionGraph}, concurrently across
 * independent branches.
 * <p>
 * The calling thread is the only coordinator: it tracks node states, decides
 * readiness and submits ready nodes to a fixed worker pool. Workers only run
 * {@link OperationRunner#run} and hand their result back through a
 * {@link CompletionService}, so node state is never written from two threads.
 * <p>
 * A node starts only after every prerequisite completed. When a node fails,
 * every node reachable from it fails with {@link FailureReason#UPSTREAM_FAILED}
 * without running. After {@link #cancel()}, nothing new is submitted, nodes
 * already running finish, and the rest end as {@link FailureReason#CANCELLED}.
 * <p>
 * Instances are single use.
 */
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final int maxConcurrency;
    private final EventBus eventBus;
    private final StackforgeMetrics metrics;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Map<String, NodeState> states = new ConcurrentHashMap<>();

    /**
     * @param maxConcurrency upper bound on concurrently running stacks; 0 or less means unbounded
     * @param eventBus       receives progress events, nullable
     * @param metrics        records timings, nullable
     */
    public PlanExecutor(int maxConcurrency, EventBus eventBus, StackforgeMetrics metrics) {
        this.maxConcurrency = maxConcurrency;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public PlanExecutor(int maxConcurrency) {
        this(maxConcurrency, null, null);
    }

    /** Stops new submissions. Safe to call from any thread. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancellation requested; no further stacks will be started");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Snapshot of the current node states, for progress reporting. */
    public Map<String, NodeState> states() {
        return Map.copyOf(states);
    }

    public PlanResult execute(ExecutionGraph graph, Operation operation, OperationRunner runner) {
        return execute(UUID.randomUUID().toString().substring(0, 8), graph, operation, runner);
    }

    public PlanResult execute(String runId, ExecutionGraph graph, Operation operation, OperationRunner runner) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A PlanExecutor runs a single plan");
        }
        Instant startedAt = Instant.now();
        MdcContext.setRun(runId);
        try {
            if (graph.isEmpty()) {
                log.info("Nothing to {}", operation.verb());
                return new PlanResult(runId, operation, Map.of(), cancelled.get(), startedAt, Instant.now());
            }
            log.info("Running {} on {} stack(s)", operation.verb(), graph.size());
            publish(StackforgeEvent.PLAN_STARTED, runId, null,
                    Map.of("operation", operation.verb(), "stacks", graph.size()));
            if (metrics != null) {
                metrics.recordPlanSize(graph.size());
            }

            Map<String, StackResult> results = coordinate(runId, graph, operation, runner);

            var ordered = new LinkedHashMap<String, StackResult>();
            graph.topologicalOrder().forEach(name -> ordered.put(name, results.get(name)));
            var plan = new PlanResult(runId, operation, ordered, cancelled.get(), startedAt, Instant.now());

            log.info("{} finished: {} complete, {} failed", operation.verb(),
                    plan.successes().size(), plan.failures().size());
            publish(StackforgeEvent.PLAN_COMPLETED, runId, null,
                    Map.of("operation", operation.verb(), "successful", plan.isSuccessful(),
                            "failed", plan.failures().size()));
            if (metrics != null) {
                metrics.recordPlanResult(operation.verb(), plan.isSuccessful());
            }
            return plan;
        } finally {
            MdcContext.clear();
        }
    }

    private Map<String, StackResult> coordinate(String runId, ExecutionGraph graph, Operation operation,
                                                OperationRunner runner) {
        int poolSize = maxConcurrency > 0 ? Math.min(maxConcurrency, graph.size()) : graph.size();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads());
        CompletionService<StackResult> completions = new ExecutorCompletionService<>(pool);

        var results = new HashMap<String, StackResult>();
        var remaining = new HashMap<String, Integer>();
        var ready = new TreeSet<String>();
        var inFlight = new HashMap<Future<StackResult>, String>();
        boolean interrupted = false;

        for (String name : graph.names()) {
            int prerequisites = graph.prerequisitesOf(name).size();
            remaining.put(name, prerequisites);
            states.put(name, prerequisites == 0 ? NodeState.READY : NodeState.PENDING);
            if (prerequisites == 0) {
                ready.add(name);
            }
        }

        try {
            while (!inFlight.isEmpty() || (!cancelled.get() && !ready.isEmpty())) {
                while (!cancelled.get() && !ready.isEmpty() && inFlight.size() < poolSize) {
                    String name = ready.pollFirst();
                    Stack stack = graph.stack(name);
                    states.put(name, NodeState.RUNNING);
                    inFlight.put(completions.submit(() -> runNode(runId, stack, operation, runner)), name);
                }

                Future<StackResult> done;
                try {
                    done = completions.take();
                } catch (InterruptedException e) {
                    // in-flight stacks are left to finish
                    interrupted = true;
                    cancel();
                    continue;
                }
                String name = inFlight.remove(done);
                StackResult result = collect(done, name, operation);
                results.put(name, result);
                states.put(name, result.state());

                if (result.isSuccessful()) {
                    for (String successor : graph.successorsOf(name)) {
                        if (remaining.merge(successor, -1, Integer::sum) == 0
                                && states.get(successor) == NodeState.PENDING) {
                            states.put(successor, NodeState.READY);
                            ready.add(successor);
                        }
                    }
                } else {
                    propagateFailure(runId, graph, operation, name, results);
                }
            }
        } finally {
            pool.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        for (String name : graph.names()) {
            if (!results.containsKey(name)) {
                StackResult result = StackResult.cancelled(name, operation);
                results.put(name, result);
                states.put(name, NodeState.FAILED);
                skipped(runId, name, result);
            }
        }
        return results;
    }

    private void propagateFailure(String runId, ExecutionGraph graph, Operation operation, String failed,
                                  Map<String, StackResult> results) {
        for (String successor : graph.transitiveSuccessorsOf(failed)) {
            if (results.containsKey(successor)) {
                continue;
            }
            StackResult result = StackResult.upstreamFailed(successor, operation, failed);
            results.put(successor, result);
            states.put(successor, NodeState.FAILED);
            log.info("{} - Skipping {}: {}", successor, operation.verb(), result.message());
            skipped(runId, successor, result);
        }
    }

    private StackResult collect(Future<StackResult> done, String name, Operation operation) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            // runNode catches runtime exceptions, so only errors end up here
            log.error("{} - Worker failed unexpectedly", name, e.getCause());
            Instant now = Instant.now();
            return StackResult.failed(name, operation, FailureReason.UNEXPECTED,
                    String.valueOf(e.getCause()), null, now);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StackResult.failed(name, operation, FailureReason.CANCELLED,
                    "Interrupted while collecting the result", null, Instant.now());
        }
    }

    private StackResult runNode(String runId, Stack stack, Operation operation, OperationRunner runner) {
        MdcContext.setStack(runId, stack.name(), operation.verb());
        Instant startedAt = Instant.now();
        StackResult result;
        try {
            log.info("{} - {} started", stack.name(), operation.verb());
            publish(StackforgeEvent.STACK_STARTED, runId, stack.name(), Map.of("operation", operation.verb()));

            try {
                OperationOutcome outcome = runner.run(stack, operation);
                result = StackResult.complete(stack.name(), operation, outcome.status(), outcome.output(),
                        startedAt, Instant.now());
                log.info("{} - {} complete ({} ms)", stack.name(), operation.verb(), result.durationMs());
            } catch (StackOperationException e) {
                result = StackResult.failed(stack.name(), operation, e.getReason(), e.getMessage(),
                        startedAt, Instant.now());
                log.info("{} - {} failed [{}]: {}", stack.name(), operation.verb(), e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                result = StackResult.failed(stack.name(), operation, FailureReason.UNEXPECTED,
                        e.getClass().getSimpleName() + ": " + e.getMessage(), startedAt, Instant.now());
                log.error("{} - Unexpected error during {}", stack.name(), operation.verb(), e);
            }

            if (metrics != null) {
                metrics.recordStackOperation(operation.verb(), result.isSuccessful() ? "complete" : "failed",
                        result.durationMs());
            }
            publish(result.isSuccessful() ? StackforgeEvent.STACK_COMPLETED : StackforgeEvent.STACK_FAILED,
                    runId, stack.name(), eventPayload(result));
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private void skipped(String runId, String name, StackResult result) {
        if (metrics != null) {
            metrics.recordSkippedStack(result.failureReason().name().toLowerCase());
        }
        publish(StackforgeEvent.STACK_SKIPPED, runId, name, eventPayload(result));
    }

    private static Map<String, Object> eventPayload(StackResult result) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("operation", result.operation().verb());
        payload.put("state", result.state().name());
        if (result.status() != null) {
            payload.put("status", result.status().name());
        }
        if (result.failureReason() != null) {
            payload.put("reason", result.failureReason().name());
            payload.put("message", result.message());
        }
        payload.put("durationMs", result.durationMs());
        return payload;
    }

    private void publish(String type, String runId, String stackName, Map<String, Object> payload) {
        if (eventBus == null) {
            return;
        }
        if (stackName == null) {
            eventBus.publishPlan(type, runId, payload);
        } else {
            eventBus.publishStack(type, runId, stackName, payload);
        }
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "stackforge-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
