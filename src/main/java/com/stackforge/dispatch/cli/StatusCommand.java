package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: stackforge status [path]
 * <p>
 * Prints the provider status of each stack, or PENDING when it does not exist.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the status of stacks")
@Component
public class StatusCommand extends PlanCommand {

    public StatusCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.STATUS;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.printf("  %-40s %s%n", result.stackName(), result.output());
    }
}
