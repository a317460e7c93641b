package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: stackforge change-set execute -n NAME [path]
 * <p>
 * A change set without changes is skipped and reported as complete.
 */
@Command(name = "execute", mixinStandardHelpOptions = true, description = "Execute a change set of each stack")
@Component
public class ExecuteChangeSetCommand extends NamedChangeSetCommand {

    public ExecuteChangeSetCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.EXECUTE_CHANGE_SET;
    }
}
