package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "create", mixinStandardHelpOptions = true,
        description = "Create a change set for each stack and wait until it is computed")
@Component
public class CreateChangeSetCommand extends NamedChangeSetCommand {

    public CreateChangeSetCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.CREATE_CHANGE_SET;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.printf("  %-40s %s%n", result.stackName(), result.output());
    }
}
