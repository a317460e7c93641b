package com.stackforge.core.model;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.hooks.Hook;
import com.stackforge.core.resolver.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One independently deployable infrastructure stack.
 * <p>
 * The attribute map is open: any value, including values nested in maps and
 * lists, may be a {@link Resolver}. The dependency set is the union of the
 * explicit {@code dependencies} attribute and the dependencies reported by
 * every resolver and hook attached to the stack. Identity and dependencies
 * never change after construction.
 */
public final class Stack {

    private static final Logger log = LoggerFactory.getLogger(Stack.class);

    public static final String PROJECT_CODE = "project_code";
    public static final String REGION = "region";
    public static final String PROFILE = "profile";
    public static final String IAM_ROLE = "iam_role";
    public static final String ROLE_ARN = "role_arn";
    public static final String TEMPLATE_PATH = "template_path";
    public static final String TEMPLATE = "template";
    public static final String PARAMETERS = "parameters";
    public static final String USER_DATA = "user_data";
    public static final String TAGS = "tags";
    public static final String NOTIFICATIONS = "notifications";
    public static final String PROTECT = "protect";
    public static final String IGNORE = "ignore";
    public static final String OBSOLETE = "obsolete";
    public static final String STACK_TIMEOUT = "stack_timeout";
    public static final String ON_FAILURE = "on_failure";
    public static final String DISABLE_ROLLBACK = "disable_rollback";
    public static final String STACK_NAME = "stack_name";
    public static final String HOOKS = "hooks";
    public static final String DEPENDENCIES = "dependencies";

    private final String name;
    private final Map<String, Object> attributes;
    private final Map<String, List<Hook>> hooks;
    private final Set<String> dependencies;

    public Stack(String name, Map<String, ?> attributes) {
        if (name == null || normalizeName(name).isEmpty()) {
            throw new InvalidConfigurationException("A stack needs a name");
        }
        this.name = normalizeName(name);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        validate();
        this.hooks = extractHooks(this.attributes.get(HOOKS));
        this.dependencies = Collections.unmodifiableSet(collectDependencies());
    }

    /**
     * Strips a leading {@code /} and a trailing {@code .yaml}/{@code .yml}, so
     * that {@code /dev/vpc.yaml} and {@code dev/vpc} name the same stack.
     */
    public static String normalizeName(String name) {
        String normalized = name.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.endsWith(".yaml")) {
            normalized = normalized.substring(0, normalized.length() - 5);
        } else if (normalized.endsWith(".yml")) {
            normalized = normalized.substring(0, normalized.length() - 4);
        }
        return normalized;
    }

    public String name() {
        return name;
    }

    /** The group path of this stack: its name without the last segment. */
    public String group() {
        int slash = name.lastIndexOf('/');
        return slash < 0 ? "" : name.substring(0, slash);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    /** Raw attribute value, possibly a resolver. */
    public Object attribute(String key) {
        return attributes.get(key);
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    /** Hooks configured for a hook point such as {@code before_create}, in order. */
    public List<Hook> hooks(String hookPoint) {
        return hooks.getOrDefault(hookPoint, List.of());
    }

    public Map<String, List<Hook>> hooks() {
        return hooks;
    }

    public String projectCode() {
        return literal(PROJECT_CODE);
    }

    public String region() {
        return literal(REGION);
    }

    public String profile() {
        return literal(PROFILE);
    }

    /** Name of the stack on the provider side. */
    public String externalName() {
        String explicit = literal(STACK_NAME);
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        String prefix = projectCode();
        String base = name.replace('/', '-');
        return prefix == null || prefix.isBlank() ? base : prefix + "-" + base;
    }

    public boolean isProtected() {
        return flag(PROTECT);
    }

    /** Skipped by bulk launches, but can still be operated on directly. */
    public boolean isIgnored() {
        return flag(IGNORE);
    }

    /** Skipped by launches and deleted by prune. */
    public boolean isObsolete() {
        return flag(OBSOLETE);
    }

    /** Timeout in minutes for create and update; 0 means no timeout. */
    public int stackTimeout() {
        Object value = attributes.get(STACK_TIMEOUT);
        if (value == null) {
            return 0;
        }
        try {
            int minutes = value instanceof Number n ? n.intValue() : Integer.parseInt(value.toString().trim());
            if (minutes < 0) {
                throw new InvalidConfigurationException("stack_timeout of '" + name + "' must not be negative");
            }
            return minutes;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("stack_timeout of '" + name + "' must be a whole number of minutes", e);
        }
    }

    private void validate() {
        boolean hasPath = attributes.get(TEMPLATE_PATH) != null;
        boolean hasTemplate = attributes.get(TEMPLATE) != null;
        if (hasPath && hasTemplate) {
            throw new InvalidConfigurationException("Stack '" + name
                    + "': both 'template_path' and 'template' are set, specify one or the other");
        }
        if (!hasPath && !hasTemplate) {
            throw new InvalidConfigurationException("Stack '" + name + "': neither 'template_path' nor 'template' is set");
        }
        if (attributes.get(ON_FAILURE) != null && flag(DISABLE_ROLLBACK)) {
            throw new InvalidConfigurationException("Stack '" + name
                    + "': 'on_failure' and 'disable_rollback' cannot both be set");
        }
        for (String key : List.of(PROTECT, IGNORE, OBSOLETE, DISABLE_ROLLBACK)) {
            Object value = attributes.get(key);
            if (value instanceof Resolver) {
                throw new InvalidConfigurationException("Stack '" + name + "': '" + key + "' must be a literal value");
            }
        }
    }

    private Map<String, List<Hook>> extractHooks(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidConfigurationException("Stack '" + name + "': 'hooks' must map hook points to lists of hooks");
        }
        var extracted = new LinkedHashMap<String, List<Hook>>();
        for (var entry : map.entrySet()) {
            String hookPoint = String.valueOf(entry.getKey());
            if (!hookPoint.startsWith("before_") && !hookPoint.startsWith("after_")) {
                throw new InvalidConfigurationException("Stack '" + name + "': unknown hook point '" + hookPoint
                        + "', expected before_<operation> or after_<operation>");
            }
            Object hookList = entry.getValue();
            List<?> elements = hookList instanceof List<?> list ? list : List.of(hookList);
            var typed = new ArrayList<Hook>();
            for (Object element : elements) {
                if (!(element instanceof Hook hook)) {
                    throw new InvalidConfigurationException("Stack '" + name + "': '" + hookPoint
                            + "' contains something that is not a hook: " + element);
                }
                typed.add(hook);
            }
            extracted.put(hookPoint, List.copyOf(typed));
        }
        return Collections.unmodifiableMap(extracted);
    }

    private Set<String> collectDependencies() {
        var collected = new LinkedHashSet<String>();
        Object explicit = attributes.get(DEPENDENCIES);
        if (explicit instanceof List<?> list) {
            for (Object dependency : list) {
                collected.add(normalizeName(String.valueOf(dependency)));
            }
        } else if (explicit != null) {
            throw new InvalidConfigurationException("Stack '" + name + "': 'dependencies' must be a list of stack names");
        }

        for (var entry : attributes.entrySet()) {
            if (!HOOKS.equals(entry.getKey()) && !DEPENDENCIES.equals(entry.getKey())) {
                attachResolvers(entry.getValue(), collected);
            }
        }
        for (List<Hook> hookList : hooks.values()) {
            for (Hook hook : hookList) {
                try {
                    hook.bind(this);
                    hook.setup();
                } catch (StackforgeException e) {
                    throw new InvalidConfigurationException("Stack '" + name + "': invalid hook " + hook
                            + ": " + e.getMessage(), e);
                }
                collected.addAll(hook.dependencies());
                attachResolvers(hook.argument(), collected);
            }
        }

        if (collected.remove(name)) {
            log.warn("Stack {} lists itself as a dependency; ignoring it", name);
        }
        return new TreeSet<>(collected);
    }

    private void attachResolvers(Object value, Set<String> collected) {
        if (value instanceof Resolver resolver) {
            try {
                resolver.bind(this);
                resolver.setup();
            } catch (StackforgeException e) {
                throw new InvalidConfigurationException("Stack '" + name + "': invalid resolver " + resolver
                        + ": " + e.getMessage(), e);
            }
            for (String dependency : resolver.dependencies()) {
                collected.add(normalizeName(dependency));
            }
            attachResolvers(resolver.argument(), collected);
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> attachResolvers(v, collected));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> attachResolvers(v, collected));
        }
    }

    private String literal(String key) {
        Object value = attributes.get(key);
        return value == null || value instanceof Resolver ? null : value.toString();
    }

    private boolean flag(String key) {
        Object value = attributes.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof Stack stack && name.equals(stack.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
