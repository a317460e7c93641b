package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "prune", mixinStandardHelpOptions = true, description = "Delete stacks marked obsolete")
@Component
public class PruneCommand extends PlanCommand {

    @Option(names = {"--yes", "-y"}, description = "Do not ask for confirmation")
    private boolean yes;

    public PruneCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        if (!confirm("Obsolete stacks under '" + path + "' will be deleted. Continue?", yes)) {
            ConsoleOutput.info("Aborted.");
            return null;
        }
        return planService.prune(path, options);
    }

    @Override
    protected Operation operation() {
        return Operation.DELETE;
    }
}
