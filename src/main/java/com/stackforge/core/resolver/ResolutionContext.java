package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;
import com.stackforge.core.provider.ConnectionKey;
import com.stackforge.core.provider.ConnectionManager;
import com.stackforge.core.provider.StackProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State for one materialization pass over a stack's configuration.
 * <p>
 * Each resolver is resolved at most once per context. Whether failing
 * resolvers are replaced by placeholders is an explicit flag chosen by the
 * caller.
 */
public class ResolutionContext {

    private static final Logger log = LoggerFactory.getLogger(ResolutionContext.class);

    private final Map<String, Stack> stacks;
    private final ConnectionManager connections;
    private final boolean placeholdersEnabled;
    private final Map<Resolver, Object> resolved = Collections.synchronizedMap(new IdentityHashMap<>());
    private final Set<Resolver> inProgress = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));

    public ResolutionContext(Map<String, Stack> stacks, ConnectionManager connections, boolean placeholdersEnabled) {
        this.stacks = stacks;
        this.connections = connections;
        this.placeholdersEnabled = placeholdersEnabled;
    }

    public boolean placeholdersEnabled() {
        return placeholdersEnabled;
    }

    public ConnectionManager connections() {
        return connections;
    }

    public Stack stack(String name) {
        Stack stack = stacks.get(name);
        if (stack == null) {
            throw new ResolutionException("Stack '" + name + "' is not part of the project");
        }
        return stack;
    }

    /**
     * Returns the provider client for the stack's region, profile and role.
     */
    public StackProvider providerFor(Stack stack) {
        Object iamRole = attribute(stack, Stack.IAM_ROLE, PlaceholderType.NONE);
        return connections.connect(new ConnectionKey(stack.region(), stack.profile(),
                iamRole == null ? null : iamRole.toString()));
    }

    /**
     * Materializes one attribute of a stack.
     *
     * @return the value, or {@code null} when the attribute is absent or resolved to no value
     */
    public Object attribute(Stack stack, String key, PlaceholderType placeholderType) {
        Object value = materialize(stack.attribute(key), placeholderType);
        return value == Resolver.NO_VALUE ? null : value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> mapAttribute(Stack stack, String key, PlaceholderType placeholderType) {
        Object value = attribute(stack, key, placeholderType);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ResolutionException("Attribute '" + key + "' of stack '" + stack.name()
                    + "' must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    public List<Object> listAttribute(Stack stack, String key, PlaceholderType placeholderType) {
        Object value = attribute(stack, key, placeholderType);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ResolutionException("Attribute '" + key + "' of stack '" + stack.name()
                    + "' must be a list, got: " + value);
        }
        return new ArrayList<>(list);
    }

    /**
     * Replaces every resolver reachable from {@code value} with its resolved
     * value. Entries that resolve to {@link Resolver#NO_VALUE} are omitted
     * from their enclosing map or list.
     *
     * @return the materialized structure, or {@link Resolver#NO_VALUE}
     */
    public Object materialize(Object value, PlaceholderType placeholderType) {
        if (value instanceof Resolver resolver) {
            Object result = resolveOnce(resolver, placeholderType);
            return result == Resolver.NO_VALUE ? result : materialize(result, placeholderType);
        }
        if (value instanceof Map<?, ?> map) {
            var materialized = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                Object item = materialize(entry.getValue(), placeholderType);
                if (item != Resolver.NO_VALUE) {
                    materialized.put(String.valueOf(entry.getKey()), item);
                }
            }
            return materialized;
        }
        if (value instanceof List<?> list) {
            var materialized = new ArrayList<>(list.size());
            for (Object element : list) {
                Object item = materialize(element, placeholderType);
                if (item != Resolver.NO_VALUE) {
                    materialized.add(item);
                }
            }
            return materialized;
        }
        return value;
    }

    private Object resolveOnce(Resolver resolver, PlaceholderType placeholderType) {
        if (resolved.containsKey(resolver)) {
            return resolved.get(resolver);
        }
        if (!inProgress.add(resolver)) {
            throw new ResolutionException("Resolving " + resolver + " requires its own value");
        }
        Object value;
        try {
            value = resolver.resolve(this);
        } catch (RuntimeException e) {
            if (!placeholdersEnabled) {
                throw e instanceof ResolutionException re ? re
                        : new ResolutionException("Could not resolve " + resolver + ": " + e.getMessage(), e);
            }
            log.debug("Using a placeholder for {}: {}", resolver, e.getMessage());
            value = placeholderType.create(resolver);
        } finally {
            inProgress.remove(resolver);
        }
        resolved.put(resolver, value);
        return value;
    }
}
