package com.stackforge.core.engine;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.events.StackforgeEvent;
import com.stackforge.core.graph.ExecutionGraph;
import com.stackforge.core.graph.StackGraph;
import com.stackforge.core.metrics.StackforgeMetrics;
import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.NodeState;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.model.StackStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.stackforge.core.model.TestStacks.stack;
import static org.junit.jupiter.api.Assertions.*;

class PlanExecutorTest {

    /** Records invocations and fails the stacks it is told to fail. */
    private static class RecordingRunner implements OperationRunner {

        final List<String> invoked = new CopyOnWriteArrayList<>();
        private final Set<String> failing;

        RecordingRunner(String... failing) {
            this.failing = Set.of(failing);
        }

        @Override
        public OperationOutcome run(Stack stack, Operation operation) {
            invoked.add(stack.name());
            if (failing.contains(stack.name())) {
                throw new StackOperationException(stack.name(), operation, FailureReason.PROVIDER_ERROR,
                        stack.name() + " rolled back");
            }
            return OperationOutcome.of(StackStatus.COMPLETE);
        }
    }

    private static ExecutionGraph forward(Stack... stacks) {
        var graph = new StackGraph(List.of(stacks));
        return graph.executionGraph(graph.stacks().keySet(), false, false);
    }

    private static ExecutionGraph chain() {
        return forward(stack("A"), stack("B", "A"), stack("C", "B"));
    }

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("a chain runs in dependency order and completes")
        void chainRunsInOrder() {
            var runner = new RecordingRunner();
            PlanResult result = new PlanExecutor(0).execute(chain(), Operation.CREATE, runner);

            assertEquals(List.of("A", "B", "C"), runner.invoked);
            assertTrue(result.isSuccessful());
            assertEquals(List.of("A", "B", "C"), List.copyOf(result.results().keySet()));
            result.results().values().forEach(r -> {
                assertEquals(NodeState.COMPLETE, r.state());
                assertEquals(StackStatus.COMPLETE, r.status());
                assertTrue(r.hasRun());
            });
        }

        @Test
        @DisplayName("a reverse graph tears dependents down first")
        void reverseOrder() {
            var graph = new StackGraph(List.of(stack("A"), stack("B", "A"), stack("C", "B")));
            var runner = new RecordingRunner();

            PlanResult result = new PlanExecutor(0).execute(
                    graph.executionGraph(Set.of("A"), true, false), Operation.DELETE, runner);

            assertEquals(List.of("C", "B", "A"), runner.invoked);
            assertTrue(result.isSuccessful());
        }

        @Test
        @DisplayName("no stack starts before all of its prerequisites completed")
        void diamondRespectsPrerequisites() {
            var completed = ConcurrentHashMap.<String>newKeySet();
            var violations = new CopyOnWriteArrayList<String>();
            ExecutionGraph graph = forward(stack("A"), stack("B", "A"), stack("C", "A"), stack("D", "B", "C"));

            new PlanExecutor(0).execute(graph, Operation.LAUNCH, (stack, operation) -> {
                if (!completed.containsAll(graph.prerequisitesOf(stack.name()))) {
                    violations.add(stack.name());
                }
                completed.add(stack.name());
                return OperationOutcome.of(StackStatus.COMPLETE);
            });

            assertTrue(violations.isEmpty(), "started too early: " + violations);
            assertEquals(Set.of("A", "B", "C", "D"), completed);
        }

        @Test
        @DisplayName("an empty graph yields an empty successful result")
        void emptyGraph() {
            var graph = new StackGraph(List.of(stack("A")));
            PlanResult result = new PlanExecutor(0).execute(graph.restrict(Set.of(), false),
                    Operation.CREATE, new RecordingRunner());

            assertTrue(result.results().isEmpty());
            assertTrue(result.isSuccessful());
        }
    }

    @Nested
    @DisplayName("failure propagation")
    class FailureTests {

        @Test
        @DisplayName("a failed stack fails its dependents without running them")
        void failurePropagates() {
            var runner = new RecordingRunner("A");
            PlanResult result = new PlanExecutor(0).execute(chain(), Operation.CREATE, runner);

            assertEquals(List.of("A"), runner.invoked);
            assertFalse(result.isSuccessful());
            assertEquals(FailureReason.PROVIDER_ERROR, result.result("A").failureReason());
            assertEquals("A rolled back", result.result("A").message());
            for (String name : List.of("B", "C")) {
                assertEquals(NodeState.FAILED, result.result(name).state());
                assertEquals(FailureReason.UPSTREAM_FAILED, result.result(name).failureReason());
                assertTrue(result.result(name).message().contains("'A'"));
                assertFalse(result.result(name).hasRun());
            }
            assertEquals(2, result.count(FailureReason.UPSTREAM_FAILED));
        }

        @Test
        @DisplayName("independent branches keep running after a failure")
        void independentBranchesContinue() {
            var runner = new RecordingRunner("B");
            ExecutionGraph graph = forward(stack("A"), stack("B", "A"), stack("C", "A"), stack("D", "B", "C"));

            PlanResult result = new PlanExecutor(0).execute(graph, Operation.LAUNCH, runner);

            assertTrue(result.result("A").isSuccessful());
            assertTrue(result.result("C").isSuccessful());
            assertEquals(FailureReason.PROVIDER_ERROR, result.result("B").failureReason());
            assertEquals(FailureReason.UPSTREAM_FAILED, result.result("D").failureReason());
            assertFalse(runner.invoked.contains("D"));
        }

        @Test
        @DisplayName("two independent stacks both complete")
        void independentStacksComplete() {
            PlanResult result = new PlanExecutor(0).execute(forward(stack("X"), stack("Y")),
                    Operation.LAUNCH, new RecordingRunner());

            assertEquals(2, result.successes().size());
        }

        @Test
        @DisplayName("an unexpected exception fails the stack as UNEXPECTED")
        void unexpectedException() {
            PlanResult result = new PlanExecutor(0).execute(chain(), Operation.UPDATE, (stack, operation) -> {
                throw new IllegalStateException("boom");
            });

            assertEquals(FailureReason.UNEXPECTED, result.result("A").failureReason());
            assertTrue(result.result("A").message().contains("boom"));
            assertEquals(FailureReason.UPSTREAM_FAILED, result.result("C").failureReason());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("max concurrency of one never runs two stacks at once")
        void maxConcurrencyOne() {
            var running = new AtomicInteger();
            var peak = new AtomicInteger();
            OperationRunner runner = (stack, operation) -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                return OperationOutcome.of(StackStatus.COMPLETE);
            };

            PlanResult result = new PlanExecutor(1).execute(
                    forward(stack("W"), stack("X"), stack("Y"), stack("Z")), Operation.CREATE, runner);

            assertTrue(result.isSuccessful());
            assertEquals(1, peak.get());
        }

        @Test
        @DisplayName("independent stacks run at the same time when unbounded")
        void independentStacksOverlap() {
            var started = new CountDownLatch(2);
            OperationRunner runner = (stack, operation) -> {
                started.countDown();
                try {
                    if (!started.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("the other stack never started");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return OperationOutcome.of(StackStatus.COMPLETE);
            };

            PlanResult result = new PlanExecutor(0).execute(forward(stack("X"), stack("Y")),
                    Operation.CREATE, runner);

            assertTrue(result.isSuccessful());
        }

        @Test
        @DisplayName("workers carry the run, stack and operation in the MDC")
        void workersSetMdc() {
            var seen = new ConcurrentHashMap<String, String>();
            new PlanExecutor(0).execute("run-42", forward(stack("A")), Operation.STATUS, (stack, operation) -> {
                seen.put("runId", MDC.get("runId"));
                seen.put("stack", MDC.get("stack"));
                seen.put("operation", MDC.get("operation"));
                return OperationOutcome.of(StackStatus.COMPLETE);
            });

            assertEquals(Map.of("runId", "run-42", "stack", "A", "operation", "status"), seen);
            assertNull(MDC.get("runId"));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("stacks not yet started end as CANCELLED")
        void cancelStopsNewStarts() {
            var executor = new PlanExecutor(0);
            var invoked = new CopyOnWriteArrayList<String>();

            PlanResult result = executor.execute(chain(), Operation.CREATE, (stack, operation) -> {
                invoked.add(stack.name());
                executor.cancel();
                return OperationOutcome.of(StackStatus.COMPLETE);
            });

            assertEquals(List.of("A"), invoked);
            assertTrue(result.cancelled());
            assertTrue(result.result("A").isSuccessful());
            assertEquals(FailureReason.CANCELLED, result.result("B").failureReason());
            assertEquals(FailureReason.CANCELLED, result.result("C").failureReason());
            assertEquals(NodeState.FAILED, executor.states().get("C"));
        }

        @Test
        @DisplayName("an executor runs a single plan")
        void singleUse() {
            var executor = new PlanExecutor(0);
            executor.execute(chain(), Operation.CREATE, new RecordingRunner());

            assertThrows(IllegalStateException.class,
                    () -> executor.execute(chain(), Operation.CREATE, new RecordingRunner()));
        }
    }

    @Nested
    @DisplayName("events and metrics")
    class ObservabilityTests {

        @Test
        @DisplayName("publishes plan and stack events and records metrics")
        void publishesEventsAndMetrics() {
            var eventBus = new EventBus();
            var registry = new SimpleMeterRegistry();
            var events = new CopyOnWriteArrayList<StackforgeEvent>();
            eventBus.subscribe("run-1", events::add);

            new PlanExecutor(0, eventBus, new StackforgeMetrics(registry))
                    .execute("run-1", chain(), Operation.CREATE, new RecordingRunner("B"));

            assertEquals(StackforgeEvent.PLAN_STARTED, events.get(0).eventType());
            assertEquals(StackforgeEvent.PLAN_COMPLETED, events.get(events.size() - 1).eventType());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(StackforgeEvent.STACK_COMPLETED)
                    && "A".equals(e.stackName())));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(StackforgeEvent.STACK_FAILED)
                    && "B".equals(e.stackName()) && "PROVIDER_ERROR".equals(e.payload().get("reason"))));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(StackforgeEvent.STACK_SKIPPED)
                    && "C".equals(e.stackName())));

            assertEquals(1.0, registry.find("stackforge.plans.total").tag("result", "failure").counter().count());
            assertEquals(1.0, registry.find("stackforge.stacks.skipped").tag("reason", "upstream_failed")
                    .counter().count());
            assertEquals(1, registry.find("stackforge.stack.duration").tag("outcome", "failed").timer().count());
        }
    }
}
