package com.stackforge.core.graph;

import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.Stack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable dependency graph over every stack of a project.
 * <p>
 * An edge {@code a -> b} means that {@code b} must finish before {@code a}.
 * Construction fails when a dependency names an unknown stack or when the
 * edges form a cycle, so a constructed graph is always a valid DAG.
 */
public final class StackGraph {

    private static final Logger log = LoggerFactory.getLogger(StackGraph.class);

    private final Map<String, Stack> stacks;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    public StackGraph(Collection<Stack> allStacks) {
        var byName = new TreeMap<String, Stack>();
        for (Stack stack : allStacks) {
            if (byName.putIfAbsent(stack.name(), stack) != null) {
                throw new InvalidConfigurationException("Stack '" + stack.name() + "' is defined more than once");
            }
        }

        var forward = new LinkedHashMap<String, Set<String>>();
        var backward = new LinkedHashMap<String, Set<String>>();
        byName.keySet().forEach(name -> {
            forward.put(name, new TreeSet<>());
            backward.put(name, new TreeSet<>());
        });
        for (Stack stack : byName.values()) {
            for (String dependency : stack.dependencies()) {
                if (!byName.containsKey(dependency)) {
                    throw new UnknownDependencyException(stack.name(), dependency);
                }
                forward.get(stack.name()).add(dependency);
                backward.get(dependency).add(stack.name());
            }
        }

        this.stacks = Collections.unmodifiableMap(byName);
        this.dependencies = freeze(forward);
        this.dependents = freeze(backward);
        detectCycles();
        log.debug("Built dependency graph with {} stacks", stacks.size());
    }

    public Map<String, Stack> stacks() {
        return stacks;
    }

    public boolean contains(String name) {
        return stacks.containsKey(name);
    }

    public Stack stack(String name) {
        Stack stack = stacks.get(name);
        if (stack == null) {
            throw new InvalidConfigurationException("Stack '" + name + "' is not part of the project");
        }
        return stack;
    }

    /** Stacks that {@code name} directly depends on. */
    public Set<String> dependenciesOf(String name) {
        return dependencies.getOrDefault(name, Set.of());
    }

    /** Stacks that directly depend on {@code name}. */
    public Set<String> dependentsOf(String name) {
        return dependents.getOrDefault(name, Set.of());
    }

    /** The given stacks plus everything they transitively depend on. */
    public Set<String> withDependencies(Collection<String> names) {
        return closure(names, dependencies);
    }

    /** The given stacks plus everything that transitively depends on them. */
    public Set<String> withDependents(Collection<String> names) {
        return closure(names, dependents);
    }

    /**
     * Builds the sub-graph an operation runs over.
     * <p>
     * Unless {@code ignoreDependencies} is set, the scope is expanded with the
     * transitive dependencies of forward operations or the transitive
     * dependents of reverse operations. Edges are restricted to the resulting
     * node set and, for reverse operations, inverted, so that every stack is
     * torn down only after its dependents.
     */
    public ExecutionGraph executionGraph(Collection<String> scope, boolean reverse, boolean ignoreDependencies) {
        for (String name : scope) {
            stack(name);
        }
        Set<String> nodes;
        if (ignoreDependencies) {
            nodes = new TreeSet<>(scope);
        } else {
            nodes = reverse ? withDependents(scope) : withDependencies(scope);
        }
        return restrict(nodes, reverse);
    }

    /** Sub-graph over exactly {@code nodes}, without any expansion. */
    public ExecutionGraph restrict(Collection<String> nodes, boolean reverse) {
        var selected = new TreeMap<String, Stack>();
        nodes.forEach(name -> selected.put(name, stack(name)));

        var prerequisites = new LinkedHashMap<String, Set<String>>();
        for (String name : selected.keySet()) {
            var before = new TreeSet<String>(reverse ? dependentsOf(name) : dependenciesOf(name));
            before.retainAll(selected.keySet());
            prerequisites.put(name, before);
        }
        return new ExecutionGraph(selected, prerequisites, reverse);
    }

    private Set<String> closure(Collection<String> start, Map<String, Set<String>> edges) {
        var visited = new TreeSet<String>();
        Deque<String> pending = new ArrayDeque<>(start);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (visited.add(current)) {
                pending.addAll(edges.getOrDefault(current, Set.of()));
            }
        }
        return visited;
    }

    private void detectCycles() {
        // 0 = unvisited, 1 = on the current path, 2 = done
        var marks = new HashMap<String, Integer>();
        for (String root : stacks.keySet()) {
            if (marks.getOrDefault(root, 0) != 0) {
                continue;
            }
            var path = new ArrayList<String>();
            Deque<Iterator<String>> frames = new ArrayDeque<>();
            marks.put(root, 1);
            path.add(root);
            frames.push(dependenciesOf(root).iterator());
            while (!frames.isEmpty()) {
                Iterator<String> frame = frames.peek();
                if (!frame.hasNext()) {
                    frames.pop();
                    marks.put(path.remove(path.size() - 1), 2);
                    continue;
                }
                String next = frame.next();
                int mark = marks.getOrDefault(next, 0);
                if (mark == 1) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    throw new CircularDependencyException(cycle);
                }
                if (mark == 0) {
                    marks.put(next, 1);
                    path.add(next);
                    frames.push(dependenciesOf(next).iterator());
                }
            }
        }
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> edges) {
        var frozen = new LinkedHashMap<String, Set<String>>();
        edges.forEach((name, targets) -> frozen.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
        return Collections.unmodifiableMap(frozen);
    }
}
