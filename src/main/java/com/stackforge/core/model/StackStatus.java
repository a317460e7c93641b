package com.stackforge.core.model;

/**
 * Simplified status of a stack on the provider side.
 */
public enum StackStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    FAILED
}
