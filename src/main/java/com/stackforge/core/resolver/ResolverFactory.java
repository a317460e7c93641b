package com.stackforge.core.resolver;

import java.util.function.Function;

/**
 * Creates resolvers for one tag. Register implementations as Spring beans to
 * make additional resolvers available to stack configuration.
 */
public interface ResolverFactory {

    String tag();

    Resolver create(Object argument);

    static ResolverFactory of(String tag, Function<Object, Resolver> constructor) {
        return new ResolverFactory() {
            @Override
            public String tag() {
                return tag;
            }

            @Override
            public Resolver create(Object argument) {
                return constructor.apply(argument);
            }
        };
    }
}
