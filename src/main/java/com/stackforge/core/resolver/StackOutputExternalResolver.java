package com.stackforge.core.resolver;

/**
 * {@code !stack_output_external}: an output of any stack reachable through the
 * owning stack's connection, given as {@code <external stack name>::<OutputKey>}.
 * No dependency is registered.
 */
public class StackOutputExternalResolver extends AbstractResolver {

    public static final String TAG = "stack_output_external";

    public StackOutputExternalResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        String[] parts = StackOutputResolver.splitReference(stringArgument(), TAG);
        return StackOutputResolver.outputValue(context.providerFor(stack()), parts[0], parts[1]);
    }
}
