package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import picocli.CommandLine.Option;

/**
 * Base for the change set commands that act on one named change set.
 */
abstract class NamedChangeSetCommand extends PlanCommand {

    @Option(names = {"-n", "--name"}, required = true, description = "Name of the change set")
    String changeSetName;

    protected NamedChangeSetCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        return super.run(path, options.withChangeSet(changeSetName));
    }
}
