package com.stackforge.core.plan;

/**
 * Caller-chosen flags for one plan run.
 *
 * @param ignoreDependencies run exactly the selected stacks, without expanding to prerequisites
 * @param maxConcurrency     cap on concurrently running stacks; 0 falls back to the configured default
 * @param placeholders       replace failing resolvers by placeholders instead of failing
 * @param prune              delete obsolete stacks before launching
 * @param changeSetName      the change set the change set operations act on, nullable
 */
public record PlanOptions(boolean ignoreDependencies, int maxConcurrency, boolean placeholders, boolean prune,
                          String changeSetName) {

    public PlanOptions {
        if (maxConcurrency < 0) {
            throw new IllegalArgumentException("maxConcurrency must not be negative: " + maxConcurrency);
        }
    }

    public PlanOptions(boolean ignoreDependencies, int maxConcurrency, boolean placeholders, boolean prune) {
        this(ignoreDependencies, maxConcurrency, placeholders, prune, null);
    }

    public static PlanOptions defaults() {
        return new PlanOptions(false, 0, false, false);
    }

    public PlanOptions withPlaceholders(boolean enabled) {
        return new PlanOptions(ignoreDependencies, maxConcurrency, enabled, prune, changeSetName);
    }

    public PlanOptions withPrune(boolean enabled) {
        return new PlanOptions(ignoreDependencies, maxConcurrency, placeholders, enabled, changeSetName);
    }

    public PlanOptions withChangeSet(String name) {
        return new PlanOptions(ignoreDependencies, maxConcurrency, placeholders, prune, name);
    }
}
