package com.stackforge.core.plan;

import com.stackforge.core.graph.ExecutionGraph;
import com.stackforge.core.graph.StackGraph;
import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Decides which stacks an operation runs over and in which direction.
 * <p>
 * A command path selects either one stack by its exact name or every stack
 * below a group; {@code .} or an empty path selects the whole project. The
 * selection is then expanded along dependencies (see
 * {@link StackGraph#executionGraph}). All checks run here, before any
 * provider call is made.
 */
public final class StackPlan {

    private static final Logger log = LoggerFactory.getLogger(StackPlan.class);

    public static final String WHOLE_PROJECT = ".";

    private final Operation operation;
    private final Set<String> commandStacks;
    private final ExecutionGraph executionGraph;

    private StackPlan(Operation operation, Set<String> commandStacks, ExecutionGraph executionGraph) {
        this.operation = operation;
        this.commandStacks = Collections.unmodifiableSet(commandStacks);
        this.executionGraph = executionGraph;
    }

    /**
     * Plans {@code operation} over the stacks selected by {@code path}.
     * <p>
     * A launch over more than one stack skips stacks marked {@code ignore} or
     * {@code obsolete}; a launch naming one stack exactly runs it anyway. With
     * {@link PlanOptions#prune()} set, a launch never runs an obsolete stack,
     * since the prune that precedes it deletes that stack.
     *
     * @throws SkippedDependencyException when a skipped stack is a prerequisite of a scheduled one
     */
    public static StackPlan of(StackGraph graph, String path, Operation operation, PlanOptions options) {
        Set<String> selected = select(graph, path);
        boolean exact = selected.size() == 1 && graph.contains(normalize(path));
        boolean launch = operation == Operation.LAUNCH;

        if (launch) {
            var kept = new TreeSet<String>();
            for (String name : selected) {
                Stack stack = graph.stack(name);
                if (skippedByLaunch(stack, exact, options)) {
                    log.info("{} - Skipped by launch (marked {})", name, flag(stack));
                } else {
                    kept.add(name);
                }
            }
            selected = kept;
        }

        ExecutionGraph executionGraph = graph.executionGraph(selected, operation.isReverse(),
                options.ignoreDependencies());

        if (launch && !options.ignoreDependencies()) {
            for (String name : executionGraph.names()) {
                Stack stack = graph.stack(name);
                if (skippedByLaunch(stack, exact, options)) {
                    String dependent = executionGraph.successorsOf(name).stream().findFirst().orElse(name);
                    throw new SkippedDependencyException(dependent, name, flag(stack));
                }
            }
        }
        log.debug("Planned {} over {} stack(s) for path '{}'", operation.verb(), executionGraph.size(), path);
        return new StackPlan(operation, selected, executionGraph);
    }

    /**
     * Plans the deletion of the obsolete stacks selected by {@code path}.
     *
     * @throws CannotPruneStackException when a stack that is not obsolete depends on an obsolete one
     */
    public static StackPlan prune(StackGraph graph, String path, PlanOptions options) {
        Set<String> obsolete = select(graph, path).stream()
                .filter(name -> graph.stack(name).isObsolete())
                .collect(Collectors.toCollection(TreeSet::new));

        ExecutionGraph executionGraph = graph.executionGraph(obsolete, true, options.ignoreDependencies());
        if (!options.ignoreDependencies()) {
            for (String name : executionGraph.names()) {
                if (graph.stack(name).isObsolete()) {
                    continue;
                }
                for (String dependency : graph.dependenciesOf(name)) {
                    if (graph.stack(dependency).isObsolete()) {
                        throw new CannotPruneStackException(dependency, name);
                    }
                }
            }
        }
        return new StackPlan(Operation.DELETE, obsolete, executionGraph);
    }

    /**
     * Names selected by a command path.
     *
     * @throws InvalidConfigurationException when nothing matches
     */
    public static Set<String> select(StackGraph graph, String path) {
        String normalized = normalize(path);
        if (normalized.isEmpty() || WHOLE_PROJECT.equals(normalized)) {
            return new TreeSet<>(graph.stacks().keySet());
        }
        if (graph.contains(normalized)) {
            return new TreeSet<>(Set.of(normalized));
        }
        String prefix = normalized.endsWith("/") ? normalized : normalized + "/";
        Set<String> selected = graph.stacks().keySet().stream()
                .filter(name -> name.startsWith(prefix))
                .collect(Collectors.toCollection(TreeSet::new));
        if (selected.isEmpty()) {
            throw new InvalidConfigurationException("No stacks match the path '" + path + "'");
        }
        return selected;
    }

    public Operation operation() {
        return operation;
    }

    /** The stacks selected by the command, before dependency expansion. */
    public Set<String> commandStacks() {
        return commandStacks;
    }

    public ExecutionGraph executionGraph() {
        return executionGraph;
    }

    public boolean isEmpty() {
        return executionGraph.isEmpty();
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.trim();
        return WHOLE_PROJECT.equals(trimmed) ? trimmed : Stack.normalizeName(trimmed);
    }

    private static boolean skippedByLaunch(Stack stack, boolean exact, PlanOptions options) {
        if (stack.isObsolete() && options.prune()) {
            return true;
        }
        return !exact && (stack.isIgnored() || stack.isObsolete());
    }

    private static String flag(Stack stack) {
        return stack.isObsolete() ? Stack.OBSOLETE : Stack.IGNORE;
    }
}
