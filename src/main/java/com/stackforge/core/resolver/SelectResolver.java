package com.stackforge.core.resolver;

import java.util.List;
import java.util.Map;

/**
 * {@code !select [index or key, list or map]}. Negative indexes count from
 * the end of the list.
 */
public class SelectResolver extends AbstractResolver {

    public static final String TAG = "select";

    private static final String USAGE = "a two-element list of [index or key, list or map]";

    public SelectResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        List<?> argument = listArgument(context, 2, USAGE);
        Object selector = argument.get(0);
        Object items = argument.get(1);
        if (items instanceof List<?> list) {
            int index = toIndex(selector);
            int effective = index < 0 ? list.size() + index : index;
            if (effective < 0 || effective >= list.size()) {
                throw new InvalidResolverArgumentException("Could not select with index " + index
                        + " from a list of " + list.size() + " items");
            }
            return list.get(effective);
        }
        if (items instanceof Map<?, ?> map) {
            String key = String.valueOf(selector);
            if (!map.containsKey(key)) {
                throw new InvalidResolverArgumentException("Could not select with key '" + key + "'");
            }
            return map.get(key);
        }
        throw new InvalidResolverArgumentException("The argument to !select must be " + USAGE + ", got: " + argument);
    }

    private int toIndex(Object selector) {
        if (selector instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(selector).trim());
        } catch (NumberFormatException e) {
            throw new InvalidResolverArgumentException("Could not select from a list with index '" + selector + "'", e);
        }
    }
}
