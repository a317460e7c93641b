package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;

import java.util.Set;

/**
 * A configuration value computed at execution time.
 * <p>
 * Lifecycle: created with its argument when configuration is read, then
 * {@link #bind(Stack)} and {@link #setup()} are called once by the owning
 * {@link Stack} while it is constructed, after which {@link #dependencies()}
 * is collected. {@link #resolve(ResolutionContext)} is called lazily while
 * the stack's configuration is materialized for an operation.
 */
public interface Resolver {

    /** Marker returned by a resolver whose value should be omitted entirely. */
    Object NO_VALUE = NoValue.INSTANCE;

    /** Registry tag this resolver was created from, e.g. {@code stack_output}. */
    String tag();

    /** The raw argument, which may itself contain resolvers. */
    Object argument();

    /** Attaches the owning stack. */
    void bind(Stack stack);

    /** Called once after {@link #bind(Stack)}, before dependencies are collected. */
    default void setup() {
    }

    /** Identities of stacks that must complete before this resolver can resolve. */
    default Set<String> dependencies() {
        return Set.of();
    }

    /**
     * Computes the value.
     *
     * @return the value, or {@link #NO_VALUE} to omit the entry holding this resolver
     * @throws ResolutionException when the value cannot be computed
     */
    Object resolve(ResolutionContext context);
}
