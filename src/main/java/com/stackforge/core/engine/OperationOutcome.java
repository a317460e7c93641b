package com.stackforge.core.engine;

import com.stackforge.core.model.StackStatus;

/**
 * What a successful operation produced.
 *
 * @param status simplified provider status after the operation
 * @param output operation-specific output such as a description, nullable
 */
public record OperationOutcome(StackStatus status, Object output) {

    public static OperationOutcome of(StackStatus status) {
        return new OperationOutcome(status, null);
    }
}
