package com.stackforge.core.resolver;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code !split [delimiter, string]}
 */
public class SplitResolver extends AbstractResolver {

    public static final String TAG = "split";

    public SplitResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        List<?> argument = listArgument(context, 2, "a list of [delimiter, string]");
        if (!(argument.get(0) instanceof String delimiter) || delimiter.isEmpty()
                || !(argument.get(1) instanceof String value)) {
            throw new InvalidResolverArgumentException(
                    "The argument to !split must be a list of [delimiter, string], got: " + argument);
        }
        return Arrays.asList(value.split(Pattern.quote(delimiter), -1));
    }
}
