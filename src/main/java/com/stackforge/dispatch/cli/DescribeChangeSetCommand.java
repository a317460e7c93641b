package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "describe", mixinStandardHelpOptions = true, description = "Show a change set of each stack")
@Component
public class DescribeChangeSetCommand extends NamedChangeSetCommand {

    public DescribeChangeSetCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.DESCRIBE_CHANGE_SET;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println("--- " + result.stackName());
        System.out.print(Yaml.write(result.output()));
    }
}
