package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import com.stackforge.core.provider.ChangeSet;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List the change sets of stacks")
@Component
public class ListChangeSetsCommand extends PlanCommand {

    public ListChangeSetsCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.LIST_CHANGE_SETS;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void printOutput(StackResult result) {
        System.out.println(result.stackName() + ":");
        for (ChangeSet changeSet : (List<ChangeSet>) result.output()) {
            System.out.printf("  %-30s %-16s %s%n", changeSet.name(), changeSet.status(), changeSet.executionStatus());
        }
    }
}
