package com.stackforge.core;

/**
 * Base class for every error raised by Stackforge.
 */
public class StackforgeException extends RuntimeException {

    public StackforgeException(String message) {
        super(message);
    }

    public StackforgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
