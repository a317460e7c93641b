package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;

import java.util.List;

/**
 * Convenience base for resolvers: holds the tag, the argument and the owning stack.
 */
public abstract class AbstractResolver implements Resolver {

    private final String tag;
    private final Object argument;
    private Stack stack;

    protected AbstractResolver(String tag, Object argument) {
        this.tag = tag;
        this.argument = argument;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public Object argument() {
        return argument;
    }

    @Override
    public void bind(Stack stack) {
        this.stack = stack;
    }

    protected Stack stack() {
        if (stack == null) {
            throw new IllegalStateException("Resolver " + this + " is not bound to a stack");
        }
        return stack;
    }

    /** Materializes the argument, resolving any resolvers nested inside it. */
    protected Object resolveArgument(ResolutionContext context) {
        return context.materialize(argument, PlaceholderType.EXPLICIT);
    }

    protected String stringArgument() {
        if (!(argument instanceof String value) || value.isBlank()) {
            throw new InvalidResolverArgumentException(
                    "The !" + tag + " resolver requires a non-empty string argument, got: " + argument);
        }
        return value;
    }

    /**
     * Materializes the argument and checks it is a list with {@code size} elements.
     */
    protected List<?> listArgument(ResolutionContext context, int size, String usage) {
        Object resolved = resolveArgument(context);
        if (!(resolved instanceof List<?> list) || list.size() != size) {
            throw new InvalidResolverArgumentException("The argument to !" + tag + " must be " + usage
                    + ", got: " + resolved);
        }
        return list;
    }

    @Override
    public String toString() {
        return argument == null ? "!" + tag : "!" + tag + "(" + argument + ")";
    }
}
