package com.stackforge.core.provider;

/**
 * Opens provider clients. One client is opened per distinct {@link ConnectionKey}.
 */
@FunctionalInterface
public interface StackProviderFactory {

    StackProvider connect(ConnectionKey key);
}
