package com.stackforge.core.hooks;

import java.util.function.Function;

/**
 * Creates hooks for one tag. Register implementations as Spring beans to
 * make additional hooks available to stack configuration.
 */
public interface HookFactory {

    String tag();

    Hook create(Object argument);

    static HookFactory of(String tag, Function<Object, Hook> constructor) {
        return new HookFactory() {
            @Override
            public String tag() {
                return tag;
            }

            @Override
            public Hook create(Object argument) {
                return constructor.apply(argument);
            }
        };
    }
}
