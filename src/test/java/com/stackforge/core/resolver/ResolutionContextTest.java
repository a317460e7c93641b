package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;
import com.stackforge.core.provider.ConnectionKey;
import com.stackforge.core.provider.ConnectionManager;
import com.stackforge.core.provider.StackProvider;
import com.stackforge.core.provider.StackProviderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.stackforge.core.model.TestStacks.stack;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResolutionContextTest {

    private StackProviderFactory factory;
    private StackProvider provider;
    private ConnectionManager connections;

    @BeforeEach
    void setUp() {
        factory = mock(StackProviderFactory.class);
        provider = mock(StackProvider.class);
        when(factory.connect(any())).thenReturn(provider);
        connections = new ConnectionManager(factory);
    }

    private ResolutionContext context(boolean placeholders, Stack... stacks) {
        var byName = new LinkedHashMap<String, Stack>();
        for (Stack stack : stacks) {
            byName.put(stack.name(), stack);
        }
        return new ResolutionContext(byName, connections, placeholders);
    }

    /** A resolver that counts its invocations. */
    private static class CountingResolver extends AbstractResolver {
        final AtomicInteger calls = new AtomicInteger();
        private final Object value;

        CountingResolver(Object value) {
            super("counting", value);
            this.value = value;
        }

        @Override
        public Object resolve(ResolutionContext context) {
            calls.incrementAndGet();
            return value;
        }
    }

    /** A resolver that always fails. */
    private static class FailingResolver extends AbstractResolver {
        FailingResolver(Object argument) {
            super("failing", argument);
        }

        @Override
        public Object resolve(ResolutionContext context) {
            throw new ResolutionException("cannot resolve " + argument());
        }
    }

    @Nested
    @DisplayName("no value")
    class NoValueTests {

        @Test
        @DisplayName("a list entry resolving to no value is omitted")
        void listEntryOmitted() {
            Stack stack = stack("app", Map.of(Stack.NOTIFICATIONS,
                    List.of("a", new NoValueResolver(null), "c")));

            List<Object> notifications = context(false, stack)
                    .listAttribute(stack, Stack.NOTIFICATIONS, PlaceholderType.EXPLICIT);

            assertEquals(List.of("a", "c"), notifications);
        }

        @Test
        @DisplayName("a map entry resolving to no value is absent")
        void mapEntryAbsent() {
            Stack stack = stack("app", Map.of(Stack.PARAMETERS,
                    Map.of("Kept", "yes", "Dropped", new NoValueResolver(null))));

            Map<String, Object> parameters = context(false, stack)
                    .mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);

            assertEquals(Map.of("Kept", "yes"), parameters);
            assertFalse(parameters.containsKey("Dropped"));
        }

        @Test
        @DisplayName("an attribute resolving to no value reads as null")
        void attributeNull() {
            Stack stack = stack("app", Map.of(Stack.ROLE_ARN, new NoValueResolver(null)));
            assertNull(context(false, stack).attribute(stack, Stack.ROLE_ARN, PlaceholderType.NONE));
            assertTrue(context(false, stack).mapAttribute(stack, Stack.TAGS, PlaceholderType.EXPLICIT).isEmpty());
        }
    }

    @Nested
    @DisplayName("placeholders")
    class PlaceholderTests {

        @Test
        @DisplayName("failures propagate when placeholders are disabled")
        void failuresPropagate() {
            Stack stack = stack("app", Map.of(Stack.PARAMETERS, Map.of("X", new FailingResolver("x"))));

            assertThrows(ResolutionException.class, () -> context(false, stack)
                    .mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT));
        }

        @Test
        @DisplayName("explicit placeholders name the resolver")
        void explicitPlaceholder() {
            Stack stack = stack("app", Map.of(Stack.PARAMETERS, Map.of("X", new FailingResolver("dev/vpc::Id"))));

            Map<String, Object> parameters = context(true, stack)
                    .mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);

            assertEquals("{ !failing(dev/vpc::Id) }", parameters.get("X"));
        }

        @Test
        @DisplayName("alphanumeric placeholders strip everything else")
        void alphanumPlaceholder() {
            Stack stack = stack("app", Map.of(Stack.USER_DATA, Map.of("X", new FailingResolver("dev/vpc::Id"))));

            Map<String, Object> userData = context(true, stack)
                    .mapAttribute(stack, Stack.USER_DATA, PlaceholderType.ALPHANUM);

            assertEquals("failingdevvpcId", userData.get("X"));
        }

        @Test
        @DisplayName("NONE placeholders read as unset")
        void nonePlaceholder() {
            Stack stack = stack("app", Map.of(Stack.IAM_ROLE, new FailingResolver("role")));
            assertNull(context(true, stack).attribute(stack, Stack.IAM_ROLE, PlaceholderType.NONE));
        }
    }

    @Nested
    @DisplayName("caching")
    class CachingTests {

        @Test
        @DisplayName("a resolver is resolved once per context")
        void resolvedOncePerContext() {
            var counting = new CountingResolver("value");
            Stack stack = stack("app", Map.of(Stack.PARAMETERS, Map.of("X", counting)));

            ResolutionContext first = context(false, stack);
            first.mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);
            first.mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);
            assertEquals(1, counting.calls.get());

            context(false, stack).mapAttribute(stack, Stack.PARAMETERS, PlaceholderType.EXPLICIT);
            assertEquals(2, counting.calls.get());
        }

        @Test
        @DisplayName("connections are shared by region, profile and role")
        void connectionsShared() {
            Stack a = stack("a", Map.of(Stack.REGION, "eu-west-1"));
            Stack b = stack("b", Map.of(Stack.REGION, "eu-west-1"));
            Stack c = stack("c", Map.of(Stack.REGION, "us-east-1"));
            ResolutionContext context = context(false, a, b, c);

            context.providerFor(a);
            context.providerFor(b);
            context.providerFor(c);

            assertEquals(2, connections.size());
            verify(factory).connect(new ConnectionKey("eu-west-1", null, null));
            verify(factory).connect(new ConnectionKey("us-east-1", null, null));
        }
    }

    @Test
    @DisplayName("a stack outside the project is a resolution error")
    void unknownStack() {
        assertThrows(ResolutionException.class, () -> context(false).stack("missing"));
    }
}
