package com.stackforge.core.diff;

import java.util.List;

/**
 * Result of comparing a stack's local definition with what is deployed.
 *
 * @param stackName       external name of the stack
 * @param deployed        false when the stack does not exist on the provider
 * @param generatedConfig the configuration the stack would be deployed with now
 * @param configDiff      differences in parameters, tags, notifications and role
 * @param templateDiff    differences in the template
 */
public record StackDiff(
    String stackName,
    boolean deployed,
    StackConfiguration generatedConfig,
    List<Difference> configDiff,
    List<Difference> templateDiff
) {

    public StackDiff {
        configDiff = List.copyOf(configDiff);
        templateDiff = List.copyOf(templateDiff);
    }

    public boolean hasDifference() {
        return !configDiff.isEmpty() || !templateDiff.isEmpty();
    }
}
