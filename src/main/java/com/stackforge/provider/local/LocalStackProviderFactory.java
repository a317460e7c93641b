package com.stackforge.provider.local;

import com.stackforge.core.provider.ConnectionKey;
import com.stackforge.core.provider.StackProvider;
import com.stackforge.core.provider.StackProviderFactory;

import java.nio.file.Path;

/**
 * Opens one {@link LocalStackProvider} per region, each with its own state directory.
 */
public class LocalStackProviderFactory implements StackProviderFactory {

    private static final String DEFAULT_REGION = "default";

    private final Path stateDir;

    public LocalStackProviderFactory(Path stateDir) {
        this.stateDir = stateDir;
    }

    @Override
    public StackProvider connect(ConnectionKey key) {
        String region = key.region() == null || key.region().isBlank() ? DEFAULT_REGION : key.region();
        return new LocalStackProvider(stateDir.resolve(region));
    }
}
