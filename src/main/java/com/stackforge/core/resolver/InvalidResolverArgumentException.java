package com.stackforge.core.resolver;

/**
 * Thrown when a resolver receives an argument of the wrong shape.
 */
public class InvalidResolverArgumentException extends ResolutionException {

    public InvalidResolverArgumentException(String message) {
        super(message);
    }

    public InvalidResolverArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
