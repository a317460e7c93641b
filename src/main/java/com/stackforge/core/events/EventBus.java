package com.stackforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for plan execution events.
 * <p>
 * Subscribers either follow one plan run or every run. The bus tracks which
 * runs are in flight: a run becomes active with its {@code plan.started} event,
 * and its {@code plan.completed} event ends it and releases the subscribers of
 * that run. Workers publish from their own threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers of a single run, keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<StackforgeEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<StackforgeEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    /**
     * Publishes an event to the subscribers of its run, then to global subscribers.
     *
     * @param event the event to deliver
     */
    public void publish(StackforgeEvent event) {
        String runId = event.runId();
        log.debug("Publishing {} for run {}{}", event.eventType(), runId,
                event.stackName() == null ? "" : " (" + event.stackName() + ")");

        if (StackforgeEvent.PLAN_STARTED.equals(event.eventType())) {
            activeRuns.add(runId);
        }
        List<Consumer<StackforgeEvent>> runSubs = runSubscribers.get(runId);
        if (runSubs != null) {
            for (Consumer<StackforgeEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<StackforgeEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
        if (StackforgeEvent.PLAN_COMPLETED.equals(event.eventType())) {
            activeRuns.remove(runId);
            if (runSubscribers.remove(runId) != null) {
                log.debug("Released subscribers of finished run {}", runId);
            }
        }
    }

    /**
     * Publishes a plan-level event, one without a stack.
     *
     * @param eventType one of the {@code PLAN_*} types of {@link StackforgeEvent}
     * @param runId     the run the event belongs to
     * @param payload   event data
     */
    public void publishPlan(String eventType, String runId, Map<String, Object> payload) {
        publish(StackforgeEvent.of(eventType, runId, null, payload));
    }

    /**
     * Publishes an event about one stack of a run.
     *
     * @param eventType one of the {@code STACK_*} types of {@link StackforgeEvent}
     * @param runId     the run the event belongs to
     * @param stackName the stack the event is about
     * @param payload   event data
     */
    public void publishStack(String eventType, String runId, String stackName, Map<String, Object> payload) {
        publish(StackforgeEvent.of(eventType, runId, stackName, payload));
    }

    /**
     * Subscribes to the events of one run. The subscription ends on its own
     * once the run publishes {@code plan.completed}.
     *
     * @param runId    the run to follow
     * @param consumer callback invoked for each event of that run
     * @return a {@link Subscription} handle to unsubscribe earlier
     */
    public Subscription subscribe(String runId, Consumer<StackforgeEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<StackforgeEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    /**
     * Subscribes to events from every run, for as long as the handle is open.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<StackforgeEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all runs");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * @return ids of the runs that started and have not completed, sorted
     */
    public Set<String> activeRuns() {
        return new TreeSet<>(activeRuns);
    }

    /**
     * @param runId a run id
     * @return the number of subscribers following that run
     */
    public int subscriberCount(String runId) {
        List<Consumer<StackforgeEvent>> subs = runSubscribers.get(runId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription; closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliverSafely(Consumer<StackforgeEvent> subscriber, StackforgeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for run {}: {}",
                    event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
