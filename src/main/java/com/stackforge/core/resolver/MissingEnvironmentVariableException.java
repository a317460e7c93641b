package com.stackforge.core.resolver;

/**
 * Thrown when an environment variable referenced by configuration is not set.
 */
public class MissingEnvironmentVariableException extends ResolutionException {

    private final String variable;

    public MissingEnvironmentVariableException(String variable) {
        super("Environment variable '" + variable + "' is not set");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
