package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a change set of each stack")
@Component
public class DeleteChangeSetCommand extends NamedChangeSetCommand {

    @Option(names = {"--yes", "-y"}, description = "Do not ask for confirmation")
    private boolean yes;

    public DeleteChangeSetCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        if (!confirm("Change set '" + changeSetName + "' of stacks under '" + path + "' will be deleted. Continue?",
                yes)) {
            ConsoleOutput.info("Aborted.");
            return null;
        }
        return super.run(path, options);
    }

    @Override
    protected Operation operation() {
        return Operation.DELETE_CHANGE_SET;
    }
}
