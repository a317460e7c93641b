package com.stackforge.core.hooks;

/**
 * Thrown when a hook receives an argument of the wrong shape.
 */
public class InvalidHookArgumentException extends HookException {

    public InvalidHookArgumentException(String message) {
        super(message);
    }
}
