package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;

import java.util.List;
import java.util.Map;

/**
 * {@code !stack_attr}: a value from the owning stack's own configuration,
 * addressed with a dotted path such as {@code user_data.vpc.cidr}.
 */
public class StackAttrResolver extends AbstractResolver {

    public static final String TAG = "stack_attr";

    public StackAttrResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        String[] segments = stringArgument().split("\\.");
        Stack stack = stack();
        Object value = switch (segments[0]) {
            case "name" -> stack.name();
            case "stack_name", "external_name" -> stack.externalName();
            default -> {
                if (!stack.attributes().containsKey(segments[0])) {
                    throw new InvalidResolverArgumentException("Stack '" + stack.name()
                            + "' has no attribute '" + segments[0] + "'");
                }
                yield context.materialize(stack.attribute(segments[0]), PlaceholderType.EXPLICIT);
            }
        };
        for (int i = 1; i < segments.length; i++) {
            value = descend(value, segments[i]);
        }
        return value;
    }

    private Object descend(Object value, String segment) {
        if (value instanceof Map<?, ?> map && map.containsKey(segment)) {
            return map.get(segment);
        }
        if (value instanceof List<?> list) {
            try {
                return list.get(Integer.parseInt(segment));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                throw new InvalidResolverArgumentException("Cannot select '" + segment + "' in " + argument(), e);
            }
        }
        throw new InvalidResolverArgumentException("Cannot select '" + segment + "' in " + argument());
    }
}
