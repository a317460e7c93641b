package com.stackforge.core.model;

/**
 * Why a stack ended in {@link NodeState#FAILED}.
 */
public enum FailureReason {
    /** The provider call failed or the stack ended in a failed state. */
    PROVIDER_ERROR,
    /** A configuration value could not be resolved. */
    RESOLUTION_ERROR,
    /** The template could not be rendered. */
    TEMPLATE_ERROR,
    /** A before or after hook failed. */
    HOOK_ERROR,
    /** The operation exceeded the stack timeout. */
    TIMEOUT,
    /** Stack protection is enabled. */
    PROTECTED,
    /** A prerequisite of this stack failed, so it never ran. */
    UPSTREAM_FAILED,
    /** The run was aborted before this stack started. */
    CANCELLED,
    UNEXPECTED
}
