package com.stackforge.core.graph;

import com.stackforge.core.model.InvalidConfigurationException;

import java.util.List;

/**
 * The dependency graph contains a cycle. The cycle is reported in traversal
 * order and starts and ends with the same stack.
 */
public class CircularDependencyException extends InvalidConfigurationException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
