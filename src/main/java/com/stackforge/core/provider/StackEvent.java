package com.stackforge.core.provider;

import java.time.Instant;

/**
 * One entry of a stack's event history.
 *
 * @param externalName      the stack the event belongs to
 * @param logicalResourceId the resource, or the stack itself, that changed
 * @param resourceType      type of that resource
 * @param status            raw status reached, e.g. {@code CREATE_COMPLETE}
 * @param statusReason      provider explanation, nullable
 * @param timestamp         when the status was reached
 */
public record StackEvent(
    String externalName,
    String logicalResourceId,
    String resourceType,
    String status,
    String statusReason,
    Instant timestamp
) {}
