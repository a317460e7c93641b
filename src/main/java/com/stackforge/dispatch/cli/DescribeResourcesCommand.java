package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import com.stackforge.core.provider.StackResource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: stackforge describe-resources [path]
 * <p>
 * Lists the logical and physical id of every resource; a stack that does not
 * exist lists nothing.
 */
@Command(name = "describe-resources", mixinStandardHelpOptions = true,
        description = "Show the resources of stacks")
@Component
public class DescribeResourcesCommand extends PlanCommand {

    public DescribeResourcesCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.DESCRIBE_RESOURCES;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void printOutput(StackResult result) {
        System.out.println(result.stackName() + ":");
        for (StackResource resource : (List<StackResource>) result.output()) {
            System.out.printf("  %-30s %s%n", resource.logicalResourceId(), resource.physicalResourceId());
        }
    }
}
