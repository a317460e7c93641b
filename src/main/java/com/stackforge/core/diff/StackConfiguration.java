package com.stackforge.core.diff;

import java.util.List;
import java.util.Map;

/**
 * The stack settings a diff compares besides the template.
 *
 * @param name          external name of the stack
 * @param parameters    template parameters
 * @param tags          stack tags
 * @param notifications notification targets
 * @param roleArn       service role, nullable
 */
public record StackConfiguration(
    String name,
    Map<String, String> parameters,
    Map<String, String> tags,
    List<String> notifications,
    String roleArn
) {}
