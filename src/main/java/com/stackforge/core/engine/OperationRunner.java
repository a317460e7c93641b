package com.stackforge.core.engine;

import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;

/**
 * Runs one operation on one stack. Called from worker threads; must be safe
 * for concurrent calls on different stacks.
 */
@FunctionalInterface
public interface OperationRunner {

    /**
     * @return the outcome when the operation succeeded
     * @throws StackOperationException when the operation failed; any other
     *                                 exception is recorded as an unexpected failure
     */
    OperationOutcome run(Stack stack, Operation operation);
}
