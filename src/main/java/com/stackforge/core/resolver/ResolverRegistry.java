package com.stackforge.core.resolver;

import com.stackforge.core.model.InvalidConfigurationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table from resolver tag to the factory creating it.
 */
public class ResolverRegistry {

    private final Map<String, ResolverFactory> factories = new LinkedHashMap<>();

    public ResolverRegistry(Collection<ResolverFactory> factories) {
        factories.forEach(this::register);
    }

    public static ResolverRegistry withBuiltins() {
        return new ResolverRegistry(builtins());
    }

    public static List<ResolverFactory> builtins() {
        return List.of(
                ResolverFactory.of(EnvironmentVariableResolver.TAG, EnvironmentVariableResolver::new),
                ResolverFactory.of(FileContentsResolver.TAG, FileContentsResolver::new),
                ResolverFactory.of(StackOutputResolver.TAG, StackOutputResolver::new),
                ResolverFactory.of(StackOutputExternalResolver.TAG, StackOutputExternalResolver::new),
                ResolverFactory.of(NoValueResolver.TAG, NoValueResolver::new),
                ResolverFactory.of(JoinResolver.TAG, JoinResolver::new),
                ResolverFactory.of(SplitResolver.TAG, SplitResolver::new),
                ResolverFactory.of(SelectResolver.TAG, SelectResolver::new),
                ResolverFactory.of(SubstituteResolver.TAG, SubstituteResolver::new),
                ResolverFactory.of(StackAttrResolver.TAG, StackAttrResolver::new)
        );
    }

    public final ResolverRegistry register(ResolverFactory factory) {
        if (factories.putIfAbsent(factory.tag(), factory) != null) {
            throw new InvalidConfigurationException("A resolver is already registered for !" + factory.tag());
        }
        return this;
    }

    public boolean supports(String tag) {
        return factories.containsKey(tag);
    }

    public Set<String> tags() {
        return factories.keySet();
    }

    public Resolver create(String tag, Object argument) {
        ResolverFactory factory = factories.get(tag);
        if (factory == null) {
            throw new InvalidConfigurationException("Unknown resolver type !" + tag
                    + " (available: " + String.join(", ", factories.keySet()) + ")");
        }
        return factory.create(argument);
    }
}
