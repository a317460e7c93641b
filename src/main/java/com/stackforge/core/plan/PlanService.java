package com.stackforge.core.plan;

import com.stackforge.core.actions.StackActions;
import com.stackforge.core.actions.StackActionsRunner;
import com.stackforge.core.config.StackforgeProperties;
import com.stackforge.core.engine.PlanExecutor;
import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.graph.ExecutionGraph;
import com.stackforge.core.metrics.StackforgeMetrics;
import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.project.Project;
import com.stackforge.core.project.ProjectLoader;
import com.stackforge.core.provider.ConnectionManager;
import com.stackforge.core.provider.StackProviderFactory;
import com.stackforge.core.template.TemplateHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for running operations over a project: loads the project,
 * plans the command path and executes the plan.
 * <p>
 * Each execution gets its own {@link ConnectionManager} and
 * {@link PlanExecutor}. Configuration errors are thrown before any provider
 * call; stack failures are reported in the returned {@link PlanResult}.
 */
@Service
public class PlanService {

    private static final Logger log = LoggerFactory.getLogger(PlanService.class);

    private final ProjectLoader loader;
    private final StackProviderFactory providerFactory;
    private final TemplateHandlerRegistry templates;
    private final StackforgeProperties properties;
    private final EventBus eventBus;
    private final StackforgeMetrics metrics;
    private final AtomicReference<PlanExecutor> current = new AtomicReference<>();

    public PlanService(ProjectLoader loader, StackProviderFactory providerFactory, TemplateHandlerRegistry templates,
                       StackforgeProperties properties, EventBus eventBus, StackforgeMetrics metrics) {
        this.loader = loader;
        this.providerFactory = providerFactory;
        this.templates = templates;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Project loadProject() {
        return loader.load(Path.of(properties.getProjectDir()));
    }

    /**
     * Runs {@code operation} over the stacks selected by {@code path}. A launch
     * with {@link PlanOptions#prune()} set prunes obsolete stacks first.
     */
    public PlanResult execute(String path, Operation operation, PlanOptions options) {
        if (operation.needsChangeSet() && (options.changeSetName() == null || options.changeSetName().isBlank())) {
            throw new InvalidConfigurationException("Operation " + operation.verb() + " needs a change set name");
        }
        Project project = loadProject();
        if (operation == Operation.LAUNCH && options.prune()) {
            return launchWithPrune(project, path, options);
        }
        StackPlan plan = StackPlan.of(project.graph(), path, operation, options);
        return run(newRunId(), project, plan, options);
    }

    /** Deletes the obsolete stacks selected by {@code path}. */
    public PlanResult prune(String path, PlanOptions options) {
        Project project = loadProject();
        return run(newRunId(), project, StackPlan.prune(project.graph(), path, options), options);
    }

    /** Stacks selected by {@code path}, expanded along dependencies, in execution order. */
    public List<Stack> list(String path, PlanOptions options) {
        Project project = loadProject();
        ExecutionGraph graph = StackPlan.of(project.graph(), path, Operation.STATUS, options).executionGraph();
        return graph.topologicalOrder().stream().map(graph::stack).toList();
    }

    /** Asks the running plan, if any, to stop starting stacks. */
    public void cancel() {
        PlanExecutor executor = current.get();
        if (executor != null) {
            log.info("Cancelling run(s) {}", eventBus.activeRuns());
            executor.cancel();
        }
    }

    private PlanResult launchWithPrune(Project project, String path, PlanOptions options) {
        // both plans are validated before anything runs
        StackPlan prune = StackPlan.prune(project.graph(), path, options);
        StackPlan launch = StackPlan.of(project.graph(), path, Operation.LAUNCH, options);

        String runId = newRunId();
        PlanResult pruned = run(runId, project, prune, options);
        if (!pruned.isSuccessful()) {
            log.warn("Pruning failed; skipping the launch");
            return pruned;
        }
        return pruned.merge(run(runId, project, launch, options));
    }

    private PlanResult run(String runId, Project project, StackPlan plan, PlanOptions options) {
        if (plan.isEmpty()) {
            log.info("Nothing to {}", plan.operation().verb());
            return PlanResult.empty(runId, plan.operation());
        }
        int maxConcurrency = options.maxConcurrency() > 0 ? options.maxConcurrency() : properties.getMaxConcurrency();
        var connections = new ConnectionManager(providerFactory);
        var actions = new StackActions(project.graph().stacks(), connections, templates,
                options.placeholders(), properties.getPollInterval());
        var executor = new PlanExecutor(maxConcurrency, eventBus, metrics);

        current.set(executor);
        try {
            var runner = new StackActionsRunner(actions, options.changeSetName());
            return executor.execute(runId, plan.executionGraph(), plan.operation(), runner);
        } finally {
            current.compareAndSet(executor, null);
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
