package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: stackforge launch [path]
 * <p>
 * Creates stacks that do not exist yet and updates the others. Stacks marked
 * ignore or obsolete are skipped unless named exactly.
 */
@Command(name = "launch", mixinStandardHelpOptions = true,
        description = "Create or update stacks and the stacks they depend on")
@Component
public class LaunchCommand extends PlanCommand {

    @Option(names = "--prune", description = "Delete obsolete stacks before launching")
    private boolean prune;

    @Option(names = {"--yes", "-y"}, description = "Do not ask for confirmation before pruning")
    private boolean yes;

    public LaunchCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        if (prune && !confirm("Obsolete stacks under '" + path + "' will be deleted. Continue?", yes)) {
            ConsoleOutput.info("Aborted.");
            return null;
        }
        return planService.execute(path, Operation.LAUNCH, options.withPrune(prune));
    }

    @Override
    protected Operation operation() {
        return Operation.LAUNCH;
    }
}
