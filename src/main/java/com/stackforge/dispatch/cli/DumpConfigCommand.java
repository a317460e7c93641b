package com.stackforge.dispatch.cli;

import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "dump-config", mixinStandardHelpOptions = true,
        description = "Print the resolved configuration of stacks")
@Component
public class DumpConfigCommand extends PlanCommand {

    public DumpConfigCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.DUMP_CONFIG;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println("--- " + result.stackName());
        System.out.print(Yaml.write(result.output()));
    }
}
