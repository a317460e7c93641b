package com.stackforge.core.hooks;

import com.stackforge.core.model.Stack;
import com.stackforge.core.resolver.PlaceholderType;
import com.stackforge.core.resolver.ResolutionContext;
import com.stackforge.core.resolver.Resolver;

/**
 * Convenience base for hooks: holds the tag, the argument and the owning stack.
 */
public abstract class AbstractHook implements Hook {

    private final String tag;
    private final Object argument;
    private Stack stack;

    protected AbstractHook(String tag, Object argument) {
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
            throw new IllegalStateException("Hook " + this + " is not bound to a stack");
        }
        return stack;
    }

    /** Materializes the argument; returns null when it resolved to no value. */
    protected Object resolveArgument(ResolutionContext context) {
        Object value = context.materialize(argument, PlaceholderType.EXPLICIT);
        return value == Resolver.NO_VALUE ? null : value;
    }

    @Override
    public String toString() {
        return argument == null ? "!" + tag : "!" + tag + "(" + argument + ")";
    }
}
