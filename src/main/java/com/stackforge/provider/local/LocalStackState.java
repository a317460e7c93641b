package com.stackforge.provider.local;

import com.stackforge.core.provider.StackEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of one stack managed by {@link LocalStackProvider}. Events
 * are kept newest first.
 */
public record LocalStackState(
    String externalName,
    String status,
    String templateBody,
    Map<String, String> parameters,
    Map<String, String> tags,
    List<String> notifications,
    String roleArn,
    Map<String, String> outputs,
    Instant lastUpdated,
    List<StackEvent> events
) {

    public LocalStackState {
        notifications = notifications == null ? List.of() : notifications;
        events = events == null ? List.of() : events;
    }
}
