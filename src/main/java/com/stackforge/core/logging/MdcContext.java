package com.stackforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Stackforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STACK = "stack";
    public static final String OPERATION = "operation";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStack(String runId, String stackName, String operation) {
        MDC.put(RUN_ID, runId);
        MDC.put(STACK, stackName);
        MDC.put(OPERATION, operation);
    }

    /** Removes the per-stack keys but keeps the run id. */
    public static void clearStack() {
        MDC.remove(STACK);
        MDC.remove(OPERATION);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STACK);
        MDC.remove(OPERATION);
    }
}
