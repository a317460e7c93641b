package com.stackforge.core.resolver;

/**
 * {@code !no_value}: removes the entry holding it, as if it was never set.
 */
public class NoValueResolver extends AbstractResolver {

    public static final String TAG = "no_value";

    public NoValueResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        return NO_VALUE;
    }
}
