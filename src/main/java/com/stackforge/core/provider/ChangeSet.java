package com.stackforge.core.provider;

import java.time.Instant;
import java.util.List;

/**
 * Provider view of one change set: a reviewed set of changes that can be
 * executed against a stack later.
 *
 * @param name            change set name, unique per stack
 * @param externalName    the stack the change set belongs to
 * @param changeSetType   {@code CREATE} for a stack that does not exist yet, {@code UPDATE} otherwise
 * @param status          raw status, e.g. {@code CREATE_COMPLETE} or {@code FAILED}
 * @param statusReason    provider explanation of the status, nullable
 * @param executionStatus e.g. {@code AVAILABLE}, {@code UNAVAILABLE}, {@code EXECUTE_COMPLETE}
 * @param changes         resource changes the change set would make
 * @param creationTime    when the change set was created
 */
public record ChangeSet(
    String name,
    String externalName,
    String changeSetType,
    String status,
    String statusReason,
    String executionStatus,
    List<ResourceChange> changes,
    Instant creationTime
) {

    public static final String TYPE_CREATE = "CREATE";
    public static final String TYPE_UPDATE = "UPDATE";

    public ChangeSet {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    /**
     * One resource affected by a change set.
     *
     * @param action            {@code Add}, {@code Modify} or {@code Remove}
     * @param logicalResourceId id of the resource in the template
     * @param resourceType      declared resource type, nullable
     */
    public record ResourceChange(String action, String logicalResourceId, String resourceType) {}
}
