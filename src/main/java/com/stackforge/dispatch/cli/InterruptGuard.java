package com.stackforge.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook for one command run. On Ctrl-C it cancels the plan and then
 * holds the JVM open until the command has reported its result, or until the
 * grace period runs out. Stacks already running are left to finish.
 */
final class InterruptGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InterruptGuard.class);

    private final Runnable cancel;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    InterruptGuard(Runnable cancel, Duration grace) {
        this.cancel = cancel;
        this.grace = grace;
        this.hook = new Thread(this::onInterrupt, "stackforge-cancel");
    }

    /** Creates a guard and registers it with the JVM. */
    static InterruptGuard install(Runnable cancel, Duration grace) {
        InterruptGuard guard = new InterruptGuard(cancel, grace);
        Runtime.getRuntime().addShutdownHook(guard.hook);
        return guard;
    }

    /**
     * Cancels the run and waits for {@link #close()}.
     *
     * @return true when the command finished within the grace period
     */
    boolean onInterrupt() {
        log.info("Interrupted; waiting for running stacks to finish");
        cancel.run();
        try {
            boolean done = finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                log.warn("Running stacks did not finish within {}; exiting anyway", grace);
            }
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    Thread hook() {
        return hook;
    }

    /** Releases a waiting hook, and unregisters it when the JVM is not shutting down. */
    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down; cancel hook stays registered");
        }
    }
}
