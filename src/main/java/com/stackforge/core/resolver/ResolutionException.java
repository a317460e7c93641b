package com.stackforge.core.resolver;

import com.stackforge.core.StackforgeException;

/**
 * Thrown when a resolver cannot compute its value.
 */
public class ResolutionException extends StackforgeException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
