package com.stackforge.core.resolver;

import com.stackforge.core.model.Stack;
import com.stackforge.core.provider.StackProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * {@code !stack_output}: an output of another stack in the project, given as
 * {@code <stack>::<OutputKey>}. A stack name without a {@code /} is taken
 * relative to the owning stack's group. The referenced stack becomes a
 * dependency of the owning stack.
 */
public class StackOutputResolver extends AbstractResolver {

    public static final String TAG = "stack_output";

    private static final Logger log = LoggerFactory.getLogger(StackOutputResolver.class);

    private String dependencyName;
    private String outputKey;

    public StackOutputResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public void setup() {
        String[] parts = splitReference(stringArgument(), TAG);
        String name = Stack.normalizeName(parts[0]);
        if (!name.contains("/") && !stack().group().isEmpty()) {
            name = stack().group() + "/" + name;
        }
        this.dependencyName = name;
        this.outputKey = parts[1];
    }

    @Override
    public Set<String> dependencies() {
        return dependencyName == null ? Set.of() : Set.of(dependencyName);
    }

    public String dependencyName() {
        return dependencyName;
    }

    public String outputKey() {
        return outputKey;
    }

    @Override
    public Object resolve(ResolutionContext context) {
        Stack target = context.stack(dependencyName);
        log.debug("Resolving output {} of stack {}", outputKey, dependencyName);
        return outputValue(context.providerFor(target), target.externalName(), outputKey);
    }

    static Object outputValue(StackProvider provider, String externalName, String outputKey) {
        Map<String, String> outputs = provider.describeOutputs(externalName);
        String value = outputs.get(outputKey);
        if (value == null) {
            throw new DependencyStackMissingOutputException(externalName, outputKey);
        }
        return value;
    }

    static String[] splitReference(String argument, String tag) {
        int separator = argument.indexOf("::");
        if (separator <= 0 || separator + 2 >= argument.length()) {
            throw new InvalidResolverArgumentException("The argument to !" + tag
                    + " must look like '<stack name>::<output key>', got: " + argument);
        }
        return new String[]{argument.substring(0, separator).trim(), argument.substring(separator + 2).trim()};
    }
}
