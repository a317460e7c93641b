package com.stackforge.core.provider;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Provider view of one stack.
 *
 * @param externalName  provider-side stack name
 * @param status        raw provider status, e.g. {@code UPDATE_ROLLBACK_COMPLETE}
 * @param statusReason  provider explanation of the status, nullable
 * @param parameters    parameters the stack was deployed with
 * @param outputs       stack outputs
 * @param lastUpdated   time of the last status change
 * @param tags          tags the stack was deployed with
 * @param notifications notification targets of the stack
 * @param roleArn       role the provider assumes for the stack, nullable
 */
public record StackDescription(
    String externalName,
    String status,
    String statusReason,
    Map<String, String> parameters,
    Map<String, String> outputs,
    Instant lastUpdated,
    Map<String, String> tags,
    List<String> notifications,
    String roleArn
) {

    public StackDescription {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        outputs = outputs == null ? Map.of() : Map.copyOf(outputs);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public StackDescription(String externalName, String status, String statusReason, Map<String, String> parameters,
                            Map<String, String> outputs, Instant lastUpdated) {
        this(externalName, status, statusReason, parameters, outputs, lastUpdated, Map.of(), List.of(), null);
    }
}
