package com.stackforge.core.hooks;

import com.stackforge.core.StackforgeException;

/**
 * Thrown when a hook fails.
 */
public class HookException extends StackforgeException {

    public HookException(String message) {
        super(message);
    }

    public HookException(String message, Throwable cause) {
        super(message, cause);
    }
}
