package com.stackforge.core.resolver;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code !join [delimiter, [items]]}
 */
public class JoinResolver extends AbstractResolver {

    public static final String TAG = "join";

    public JoinResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        List<?> argument = listArgument(context, 2, "a list of [delimiter, [items]]");
        if (!(argument.get(0) instanceof String delimiter) || !(argument.get(1) instanceof List<?> items)) {
            throw new InvalidResolverArgumentException(
                    "The argument to !join must be a list of [delimiter, [items]], got: " + argument);
        }
        return items.stream().map(String::valueOf).collect(Collectors.joining(delimiter));
    }
}
