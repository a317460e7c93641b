package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "create", mixinStandardHelpOptions = true, description = "Create stacks and the stacks they depend on")
@Component
public class CreateCommand extends PlanCommand {

    public CreateCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.CREATE;
    }
}
