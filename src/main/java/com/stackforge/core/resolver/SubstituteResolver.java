package com.stackforge.core.resolver;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code !sub [template, {variables}]}: replaces {@code {name}} in the template
 * with the matching variable.
 */
public class SubstituteResolver extends AbstractResolver {

    public static final String TAG = "sub";

    private static final Pattern VARIABLE = Pattern.compile("\\{(\\w+)}");

    public SubstituteResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        List<?> argument = listArgument(context, 2, "a list of [template, {variables}]");
        if (!(argument.get(0) instanceof String template) || !(argument.get(1) instanceof Map<?, ?> variables)) {
            throw new InvalidResolverArgumentException(
                    "The argument to !sub must be a list of [template, {variables}], got: " + argument);
        }
        Matcher matcher = VARIABLE.matcher(template);
        var result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!variables.containsKey(name)) {
                throw new InvalidResolverArgumentException("No value was given for '" + name + "' in !sub template: "
                        + template);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(variables.get(name))));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
