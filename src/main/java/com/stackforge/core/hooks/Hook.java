package com.stackforge.core.hooks;

import com.stackforge.core.model.Stack;
import com.stackforge.core.resolver.ResolutionContext;

import java.util.Set;

/**
 * A side effect run immediately before or after an operation on a stack.
 * Hooks do not take part in dependency ordering themselves, although
 * resolvers nested in their argument do.
 */
public interface Hook {

    /** Registry tag this hook was created from, e.g. {@code cmd}. */
    String tag();

    /** The raw argument, which may contain resolvers. */
    Object argument();

    /** Attaches the owning stack. */
    void bind(Stack stack);

    /** Called once after {@link #bind(Stack)}. */
    default void setup() {
    }

    default Set<String> dependencies() {
        return Set.of();
    }

    /**
     * Runs the hook.
     *
     * @throws HookException when the hook fails; the bracketed operation is aborted
     */
    void run(ResolutionContext context);
}
