package com.stackforge.core.resolver;

/**
 * Thrown when a referenced stack exists but lacks the requested output.
 */
public class DependencyStackMissingOutputException extends ResolutionException {

    public DependencyStackMissingOutputException(String stackName, String outputKey) {
        super("The stack '" + stackName + "' does not have an output named '" + outputKey + "'");
    }
}
