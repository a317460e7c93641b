package com.stackforge.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static StackforgeEvent event(String type, String runId, String stack) {
        return StackforgeEvent.of(type, runId, stack, Map.of());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversEventToRunSubscriber() {
            List<StackforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("run-1", received::add);

            var event = event(StackforgeEvent.STACK_STARTED, "run-1", "dev/vpc");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different run")
        void doesNotDeliverToDifferentRun() {
            List<StackforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("run-2", received::add);

            eventBus.publish(event(StackforgeEvent.STACK_STARTED, "run-1", "dev/vpc"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversMultipleEventsInOrder() {
            List<StackforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("run-1", received::add);

            eventBus.publish(event(StackforgeEvent.PLAN_STARTED, "run-1", null));
            eventBus.publish(event(StackforgeEvent.STACK_STARTED, "run-1", "dev/vpc"));
            eventBus.publish(event(StackforgeEvent.STACK_COMPLETED, "run-1", "dev/vpc"));

            assertEquals(List.of("plan.started", "stack.started", "stack.completed"),
                    received.stream().map(StackforgeEvent::eventType).toList());
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber receives events from all runs")
        void globalSubscriberReceivesAllEvents() {
            List<StackforgeEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(StackforgeEvent.PLAN_STARTED, "run-1", null));
            eventBus.publish(event(StackforgeEvent.PLAN_STARTED, "run-2", null));

            assertEquals(List.of("run-1", "run-2"), received.stream().map(StackforgeEvent::runId).toList());
        }

        @Test
        @DisplayName("closing the subscription stops delivery")
        void closeStopsDelivery() {
            List<StackforgeEvent> received = new ArrayList<>();
            try (EventBus.Subscription ignored = eventBus.subscribeAll(received::add)) {
                eventBus.publish(event(StackforgeEvent.PLAN_STARTED, "run-1", null));
            }
            eventBus.publish(event(StackforgeEvent.PLAN_STARTED, "run-2", null));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void unsubscribeDoesNotAffectOthers() {
            List<StackforgeEvent> received1 = new ArrayList<>();
            List<StackforgeEvent> received2 = new ArrayList<>();
            EventBus.Subscription sub1 = eventBus.subscribe("run-1", received1::add);
            eventBus.subscribe("run-1", received2::add);

            sub1.unsubscribe();
            eventBus.publish(event(StackforgeEvent.STACK_FAILED, "run-1", "dev/app"));

            assertTrue(received1.isEmpty());
            assertEquals(1, received2.size());
        }
    }

    @Nested
    @DisplayName("run lifecycle")
    class RunLifecycleTests {

        @Test
        @DisplayName("a run is active between plan.started and plan.completed")
        void activeRuns() {
            eventBus.publishPlan(StackforgeEvent.PLAN_STARTED, "run-2", Map.of());
            eventBus.publishPlan(StackforgeEvent.PLAN_STARTED, "run-1", Map.of());
            assertEquals(List.of("run-1", "run-2"), List.copyOf(eventBus.activeRuns()));

            eventBus.publishPlan(StackforgeEvent.PLAN_COMPLETED, "run-1", Map.of());
            assertEquals(List.of("run-2"), List.copyOf(eventBus.activeRuns()));
        }

        @Test
        @DisplayName("run subscribers receive plan.completed and are then released")
        void completionReleasesSubscribers() {
            List<String> received = new ArrayList<>();
            eventBus.subscribe("run-1", e -> received.add(e.eventType()));
            assertEquals(1, eventBus.subscriberCount("run-1"));

            eventBus.publishPlan(StackforgeEvent.PLAN_STARTED, "run-1", Map.of());
            eventBus.publishStack(StackforgeEvent.STACK_COMPLETED, "run-1", "dev/vpc", Map.of("status", "COMPLETE"));
            eventBus.publishPlan(StackforgeEvent.PLAN_COMPLETED, "run-1", Map.of());
            eventBus.publishStack(StackforgeEvent.STACK_STARTED, "run-1", "dev/late", Map.of());

            assertEquals(List.of("plan.started", "stack.completed", "plan.completed"), received);
            assertEquals(0, eventBus.subscriberCount("run-1"));
        }

        @Test
        @DisplayName("publishStack carries the stack name and payload")
        void publishStack() {
            List<StackforgeEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publishStack(StackforgeEvent.STACK_FAILED, "run-1", "dev/app", Map.of("reason", "TIMEOUT"));

            StackforgeEvent event = received.get(0);
            assertEquals("dev/app", event.stackName());
            assertEquals("TIMEOUT", event.payload().get("reason"));
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("handles concurrent publishes from worker threads")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<StackforgeEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("run-1", received::add);

            int threadCount = 8;
            int eventsPerThread = 50;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event(StackforgeEvent.STACK_COMPLETED, "run-1", "stack-" + threadId));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }

    @Test
    @DisplayName("subscriber exception does not prevent delivery to other subscribers")
    void subscriberExceptionDoesNotPreventOthers() {
        List<StackforgeEvent> received = new ArrayList<>();
        eventBus.subscribe("run-1", e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe("run-1", received::add);

        eventBus.publish(event(StackforgeEvent.STACK_STARTED, "run-1", "dev/vpc"));

        assertEquals(1, received.size());
    }
}
