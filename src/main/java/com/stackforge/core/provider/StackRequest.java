package com.stackforge.core.provider;

import java.util.List;
import java.util.Map;

/**
 * Everything the provider needs to create or update one stack.
 *
 * @param externalName    provider-side stack name
 * @param templateBody    rendered infrastructure description
 * @param parameters      template parameters, already materialized
 * @param tags            stack tags
 * @param notifications   notification topic identifiers
 * @param roleArn         service role the provider assumes, nullable
 * @param onFailure       create-failure behavior, nullable
 * @param disableRollback whether failed creates are kept
 * @param timeoutMinutes  provider-side create timeout; 0 for none
 */
public record StackRequest(
    String externalName,
    String templateBody,
    Map<String, String> parameters,
    Map<String, String> tags,
    List<String> notifications,
    String roleArn,
    String onFailure,
    boolean disableRollback,
    int timeoutMinutes
) {

    public StackRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }
}
