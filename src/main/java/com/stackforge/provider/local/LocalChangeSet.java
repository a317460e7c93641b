package com.stackforge.provider.local;

import com.stackforge.core.provider.ChangeSet;
import com.stackforge.core.provider.StackRequest;

/**
 * Persisted form of a change set: what it reports and the request it applies
 * when executed.
 */
public record LocalChangeSet(ChangeSet changeSet, StackRequest request) {}
