package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;

/**
 * The stack is in a failed state that launch cannot recover from.
 */
public class CannotUpdateFailedStackException extends StackforgeException {

    public CannotUpdateFailedStackException(String stackName, String status) {
        super("'" + stackName + "' is in the state '" + status + "' and cannot be updated");
    }
}
