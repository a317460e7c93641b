package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "describe-events", mixinStandardHelpOptions = true,
        description = "Show the event history of stacks, newest first")
@Component
public class DescribeEventsCommand extends PlanCommand {

    public DescribeEventsCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.DESCRIBE_EVENTS;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println("--- " + result.stackName());
        System.out.print(Yaml.write(result.output()));
    }
}
