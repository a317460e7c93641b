package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

@Command(name = "outputs", mixinStandardHelpOptions = true, description = "Show the outputs of stacks")
@Component
public class OutputsCommand extends PlanCommand {

    public OutputsCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.OUTPUTS;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println(result.stackName() + ":");
        ((Map<?, ?>) result.output()).forEach((key, value) ->
                System.out.printf("  %-30s %s%n", key, value));
    }
}
