package com.stackforge.core.resolver;

/**
 * Sentinel for a value that should be treated as unset.
 */
public enum NoValue {
    INSTANCE;

    @Override
    public String toString() {
        return "NO_VALUE";
    }
}
