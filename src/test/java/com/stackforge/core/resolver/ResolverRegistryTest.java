package com.stackforge.core.resolver;

import com.stackforge.core.model.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolverRegistryTest {

    @Test
    @DisplayName("builtins cover every documented tag")
    void builtins() {
        var registry = ResolverRegistry.withBuiltins();
        assertTrue(registry.tags().containsAll(List.of("env", "file_contents", "stack_output",
                "stack_output_external", "no_value", "join", "split", "select", "sub", "stack_attr")));
    }

    @Test
    @DisplayName("create builds a resolver carrying its tag and argument")
    void create() {
        Resolver resolver = ResolverRegistry.withBuiltins().create("stack_output", "dev/vpc::VpcId");

        assertInstanceOf(StackOutputResolver.class, resolver);
        assertEquals("stack_output", resolver.tag());
        assertEquals("dev/vpc::VpcId", resolver.argument());
        assertEquals("!stack_output(dev/vpc::VpcId)", resolver.toString());
    }

    @Test
    @DisplayName("an unknown tag is a configuration error listing the known ones")
    void unknownTag() {
        var e = assertThrows(InvalidConfigurationException.class,
                () -> ResolverRegistry.withBuiltins().create("nope", "x"));
        assertTrue(e.getMessage().contains("!nope"));
        assertTrue(e.getMessage().contains("stack_output"));
    }

    @Test
    @DisplayName("extensions register next to the builtins, but may not shadow them")
    void extensions() {
        var registry = ResolverRegistry.withBuiltins()
                .register(ResolverFactory.of("upper", argument -> new AbstractResolver("upper", argument) {
                    @Override
                    public Object resolve(ResolutionContext context) {
                        return String.valueOf(argument()).toUpperCase();
                    }
                }));

        assertTrue(registry.supports("upper"));
        assertThrows(InvalidConfigurationException.class,
                () -> registry.register(ResolverFactory.of("env", EnvironmentVariableResolver::new)));
    }
}
