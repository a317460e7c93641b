package com.stackforge.core.model;

import com.stackforge.core.hooks.CmdHook;
import com.stackforge.core.resolver.EnvironmentVariableResolver;
import com.stackforge.core.resolver.JoinResolver;
import com.stackforge.core.resolver.StackOutputResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.stackforge.core.model.TestStacks.stack;
import static org.junit.jupiter.api.Assertions.*;

class StackTest {

    @Nested
    @DisplayName("names")
    class NameTests {

        @Test
        @DisplayName("normalizes leading slashes and YAML extensions")
        void normalizeName() {
            assertEquals("dev/vpc", Stack.normalizeName("/dev/vpc.yaml"));
            assertEquals("dev/vpc", Stack.normalizeName("dev/vpc.yml"));
            assertEquals("dev/vpc", Stack.normalizeName("dev\\vpc"));
        }

        @Test
        @DisplayName("group is the name without its last segment")
        void group() {
            assertEquals("dev/network", stack("dev/network/vpc").group());
            assertEquals("", stack("vpc").group());
        }

        @Test
        @DisplayName("external name joins the project code and the name")
        void externalName() {
            assertEquals("test-dev-network-vpc", stack("dev/network/vpc").externalName());
            assertEquals("custom", stack("dev/vpc", Map.of(Stack.STACK_NAME, "custom")).externalName());
        }

        @Test
        @DisplayName("a blank name is rejected")
        void blankName() {
            assertThrows(InvalidConfigurationException.class, () -> stack("  "));
        }

        @Test
        @DisplayName("stacks are equal by name")
        void equality() {
            assertEquals(stack("dev/vpc"), stack("/dev/vpc.yaml"));
            assertEquals(stack("dev/vpc").hashCode(), stack("dev/vpc").hashCode());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("template_path and template are mutually exclusive")
        void templateConflict() {
            assertThrows(InvalidConfigurationException.class,
                    () -> stack("a", Map.of(Stack.TEMPLATE, Map.of("type", "file"))));
        }

        @Test
        @DisplayName("a stack needs a template")
        void templateMissing() {
            assertThrows(InvalidConfigurationException.class, () -> new Stack("a", Map.of()));
        }

        @Test
        @DisplayName("on_failure and disable_rollback cannot both be set")
        void rollbackConflict() {
            assertThrows(InvalidConfigurationException.class, () -> stack("a",
                    Map.of(Stack.ON_FAILURE, "DELETE", Stack.DISABLE_ROLLBACK, true)));
        }

        @Test
        @DisplayName("protect must be a literal")
        void protectLiteral() {
            assertThrows(InvalidConfigurationException.class,
                    () -> stack("a", Map.of(Stack.PROTECT, new EnvironmentVariableResolver("PROTECT"))));
        }

        @Test
        @DisplayName("stack_timeout must be a non-negative number of minutes")
        void stackTimeout() {
            assertEquals(0, stack("a").stackTimeout());
            assertEquals(15, stack("a", Map.of(Stack.STACK_TIMEOUT, 15)).stackTimeout());
            assertEquals(5, stack("a", Map.of(Stack.STACK_TIMEOUT, "5")).stackTimeout());
            assertThrows(InvalidConfigurationException.class,
                    () -> stack("a", Map.of(Stack.STACK_TIMEOUT, -1)).stackTimeout());
            assertThrows(InvalidConfigurationException.class,
                    () -> stack("a", Map.of(Stack.STACK_TIMEOUT, "soon")).stackTimeout());
        }

        @Test
        @DisplayName("flags accept booleans and strings")
        void flags() {
            Stack stack = stack("a", Map.of(Stack.PROTECT, true, Stack.IGNORE, "true", Stack.OBSOLETE, false));
            assertTrue(stack.isProtected());
            assertTrue(stack.isIgnored());
            assertFalse(stack.isObsolete());
        }
    }

    @Nested
    @DisplayName("dependencies")
    class DependencyTests {

        @Test
        @DisplayName("explicit dependencies are normalized")
        void explicitDependencies() {
            assertEquals(Set.of("dev/vpc"), stack("dev/app", "/dev/vpc.yaml").dependencies());
        }

        @Test
        @DisplayName("stack_output resolvers contribute dependencies, relative to the group")
        void resolverDependencies() {
            Stack stack = stack("dev/app", Map.of(Stack.PARAMETERS, Map.of(
                    "VpcId", new StackOutputResolver("vpc::VpcId"),
                    "Subnets", new JoinResolver(List.of(",", List.of(
                            new StackOutputResolver("shared/subnets::A"))))
            )));

            assertEquals(Set.of("dev/vpc", "shared/subnets"), stack.dependencies());
        }

        @Test
        @DisplayName("resolvers inside hook arguments contribute dependencies")
        void hookDependencies() {
            Stack stack = stack("dev/app", Map.of(Stack.HOOKS, Map.of(
                    "before_create", List.of(new CmdHook(new StackOutputResolver("dev/db::Endpoint"))))));

            assertEquals(Set.of("dev/db"), stack.dependencies());
            assertEquals(1, stack.hooks("before_create").size());
            assertTrue(stack.hooks("after_create").isEmpty());
        }

        @Test
        @DisplayName("a self dependency is dropped")
        void selfDependency() {
            assertTrue(stack("dev/app", "dev/app").dependencies().isEmpty());
        }

        @Test
        @DisplayName("an unknown hook point is rejected")
        void unknownHookPoint() {
            assertThrows(InvalidConfigurationException.class, () -> stack("a",
                    Map.of(Stack.HOOKS, Map.of("during_create", List.of(new CmdHook("true"))))));
        }

        @Test
        @DisplayName("a malformed resolver argument is a configuration error")
        void malformedResolver() {
            assertThrows(InvalidConfigurationException.class, () -> stack("a",
                    Map.of(Stack.PARAMETERS, Map.of("X", new StackOutputResolver("no-separator")))));
        }
    }
}
