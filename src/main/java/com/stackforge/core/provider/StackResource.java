package com.stackforge.core.provider;

/**
 * A resource the provider manages as part of a stack.
 *
 * @param logicalResourceId  id of the resource in the template
 * @param physicalResourceId id the provider assigned to it
 * @param resourceType       declared resource type
 * @param status             raw resource status
 */
public record StackResource(
    String logicalResourceId,
    String physicalResourceId,
    String resourceType,
    String status
) {}
