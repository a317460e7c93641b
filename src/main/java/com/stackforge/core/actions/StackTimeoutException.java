package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;

/**
 * An update did not finish within the stack's {@code stack_timeout}. The
 * update has been cancelled when this is thrown.
 */
public class StackTimeoutException extends StackforgeException {

    public StackTimeoutException(String stackName, int minutes, String statusAfterCancel) {
        super("Update of '" + stackName + "' exceeded the timeout of " + minutes
                + " minute(s) and was cancelled (status after cancel: " + statusAfterCancel + ")");
    }
}
