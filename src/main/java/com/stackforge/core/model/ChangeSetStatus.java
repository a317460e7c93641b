package com.stackforge.core.model;

/**
 * Simplified status of a change set.
 */
public enum ChangeSetStatus {
    /** Still being computed by the provider. */
    PENDING,
    /** Computed and available for execution. */
    READY,
    /** Computed, but the stack would not change. */
    NO_CHANGES,
    /** Failed, deleted, executed or superseded; it cannot be executed. */
    DEFUNCT
}
