package com.stackforge.core.model;

import com.stackforge.core.StackforgeException;

/**
 * Thrown when stack configuration is invalid. Always raised before any
 * external call is made.
 */
public class InvalidConfigurationException extends StackforgeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
