package com.stackforge.core.hooks;

import com.stackforge.core.model.InvalidConfigurationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table from hook tag to the factory creating it.
 */
public class HookRegistry {

    private final Map<String, HookFactory> factories = new LinkedHashMap<>();

    public HookRegistry(Collection<HookFactory> factories) {
        factories.forEach(this::register);
    }

    public static HookRegistry withBuiltins() {
        return new HookRegistry(builtins());
    }

    public static List<HookFactory> builtins() {
        return List.of(HookFactory.of(CmdHook.TAG, CmdHook::new));
    }

    public final HookRegistry register(HookFactory factory) {
        if (factories.putIfAbsent(factory.tag(), factory) != null) {
            throw new InvalidConfigurationException("A hook is already registered for !" + factory.tag());
        }
        return this;
    }

    public boolean supports(String tag) {
        return factories.containsKey(tag);
    }

    public Set<String> tags() {
        return factories.keySet();
    }

    public Hook create(String tag, Object argument) {
        HookFactory factory = factories.get(tag);
        if (factory == null) {
            throw new InvalidConfigurationException("Unknown hook type !" + tag
                    + " (available: " + String.join(", ", factories.keySet()) + ")");
        }
        return factory.create(argument);
    }
}
