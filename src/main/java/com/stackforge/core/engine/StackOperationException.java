package com.stackforge.core.engine;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.Operation;

/**
 * Failure of one stack's operation, carrying enough context for the plan
 * result and for diagnostics.
 */
public class StackOperationException extends StackforgeException {

    private final String stackName;
    private final Operation operation;
    private final FailureReason reason;

    public StackOperationException(String stackName, Operation operation, FailureReason reason,
                                   String message, Throwable cause) {
        super(message, cause);
        this.stackName = stackName;
        this.operation = operation;
        this.reason = reason;
    }

    public StackOperationException(String stackName, Operation operation, FailureReason reason, String message) {
        this(stackName, operation, reason, message, null);
    }

    public String getStackName() {
        return stackName;
    }

    public Operation getOperation() {
        return operation;
    }

    public FailureReason getReason() {
        return reason;
    }
}
