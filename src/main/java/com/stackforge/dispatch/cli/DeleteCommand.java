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
 * CLI command: stackforge delete [path]
 * <p>
 * Deletes the selected stacks and every stack depending on them, dependents first.
 */
@Command(name = "delete", mixinStandardHelpOptions = true,
        description = "Delete stacks and the stacks that depend on them")
@Component
public class DeleteCommand extends PlanCommand {

    @Option(names = {"--yes", "-y"}, description = "Do not ask for confirmation")
    private boolean yes;

    public DeleteCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        if (!confirm("Stacks under '" + path + "' and their dependents will be deleted. Continue?", yes)) {
            ConsoleOutput.info("Aborted.");
            return null;
        }
        return super.run(path, options);
    }

    @Override
    protected Operation operation() {
        return Operation.DELETE;
    }
}
