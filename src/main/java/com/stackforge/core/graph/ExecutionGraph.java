package com.stackforge.core.graph;

import com.stackforge.core.model.Stack;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The sub-graph one operation runs over, already oriented in execution
 * direction: a node may start once all of its {@linkplain #prerequisitesOf
 * prerequisites} have completed. Read-only.
 */
public final class ExecutionGraph {

    private final Map<String, Stack> stacks;
    private final Map<String, Set<String>> prerequisites;
    private final Map<String, Set<String>> successors;
    private final boolean reverse;

    ExecutionGraph(Map<String, Stack> stacks, Map<String, Set<String>> prerequisites, boolean reverse) {
        this.stacks = Collections.unmodifiableMap(new LinkedHashMap<>(stacks));
        this.reverse = reverse;

        var before = new LinkedHashMap<String, Set<String>>();
        var after = new LinkedHashMap<String, Set<String>>();
        stacks.keySet().forEach(name -> after.put(name, new TreeSet<>()));
        prerequisites.forEach((name, required) -> {
            before.put(name, Collections.unmodifiableSet(new TreeSet<>(required)));
            required.forEach(r -> after.get(r).add(name));
        });
        after.replaceAll((name, targets) -> Collections.unmodifiableSet(targets));
        this.prerequisites = Collections.unmodifiableMap(before);
        this.successors = Collections.unmodifiableMap(after);
    }

    /** An execution graph with no edges, for single-stack runs that skip dependencies. */
    public static ExecutionGraph of(Stack... stacks) {
        var nodes = new LinkedHashMap<String, Stack>();
        var edges = new LinkedHashMap<String, Set<String>>();
        for (Stack stack : stacks) {
            nodes.put(stack.name(), stack);
            edges.put(stack.name(), Set.of());
        }
        return new ExecutionGraph(nodes, edges, false);
    }

    public Map<String, Stack> stacks() {
        return stacks;
    }

    public Set<String> names() {
        return stacks.keySet();
    }

    public Stack stack(String name) {
        return stacks.get(name);
    }

    public boolean contains(String name) {
        return stacks.containsKey(name);
    }

    public int size() {
        return stacks.size();
    }

    public boolean isEmpty() {
        return stacks.isEmpty();
    }

    /** True when edges were inverted for a teardown operation. */
    public boolean isReverse() {
        return reverse;
    }

    /** Nodes that must complete before {@code name} may start. */
    public Set<String> prerequisitesOf(String name) {
        return prerequisites.getOrDefault(name, Set.of());
    }

    /** Nodes waiting on {@code name}. */
    public Set<String> successorsOf(String name) {
        return successors.getOrDefault(name, Set.of());
    }

    /** Every node reachable from {@code name} through successor edges, excluding itself. */
    public Set<String> transitiveSuccessorsOf(String name) {
        var reached = new TreeSet<String>();
        Deque<String> pending = new ArrayDeque<>(successorsOf(name));
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (reached.add(current)) {
                pending.addAll(successorsOf(current));
            }
        }
        return reached;
    }

    /**
     * A sequential order consistent with the edges, ties broken by name.
     * Used for listings and dry runs.
     */
    public List<String> topologicalOrder() {
        var remaining = new HashMap<String, Integer>();
        prerequisites.forEach((name, required) -> remaining.put(name, required.size()));
        var ready = new TreeSet<String>();
        remaining.forEach((name, count) -> {
            if (count == 0) {
                ready.add(name);
            }
        });

        var ordered = new ArrayList<String>(stacks.size());
        while (!ready.isEmpty()) {
            String current = ready.pollFirst();
            ordered.add(current);
            for (String successor : successorsOf(current)) {
                if (remaining.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(successor);
                }
            }
        }
        return ordered;
    }
}
