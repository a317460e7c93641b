package com.stackforge.core.resolver;

import java.util.function.Function;

/**
 * {@code !env}: the value of an environment variable.
 */
public class EnvironmentVariableResolver extends AbstractResolver {

    public static final String TAG = "env";

    private final Function<String, String> environment;

    public EnvironmentVariableResolver(Object argument) {
        this(argument, System::getenv);
    }

    EnvironmentVariableResolver(Object argument, Function<String, String> environment) {
        super(TAG, argument);
        this.environment = environment;
    }

    @Override
    public Object resolve(ResolutionContext context) {
        String name = stringArgument();
        String value = environment.apply(name);
        if (value == null) {
            throw new MissingEnvironmentVariableException(name);
        }
        return value;
    }
}
