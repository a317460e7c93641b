package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "update", mixinStandardHelpOptions = true, description = "Update stacks and the stacks they depend on")
@Component
public class UpdateCommand extends PlanCommand {

    public UpdateCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.UPDATE;
    }
}
