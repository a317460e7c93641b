package com.stackforge.core.provider;

import com.stackforge.core.StackforgeException;

/**
 * Error reported by the provider. The message is the provider's own.
 */
public class ProviderException extends StackforgeException {

    public static final String ALREADY_EXISTS = "AlreadyExists";
    public static final String NO_UPDATES = "NoUpdates";
    public static final String VALIDATION_ERROR = "ValidationError";
    public static final String INTERNAL_FAILURE = "InternalFailure";

    private final String code;

    public ProviderException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ProviderException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean hasCode(String expected) {
        return expected.equals(code);
    }
}
