package com.stackforge.core.model;

/**
 * Execution state of one stack within a plan run.
 */
public enum NodeState {
    PENDING,
    READY,
    RUNNING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
