package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "generate", mixinStandardHelpOptions = true, description = "Print the rendered templates of stacks")
@Component
public class GenerateCommand extends PlanCommand {

    @Option(names = "--no-placeholders", description = "Fail on unresolvable values instead of using placeholders")
    private boolean noPlaceholders;

    public GenerateCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        return super.run(path, options.withPlaceholders(!noPlaceholders));
    }

    @Override
    protected Operation operation() {
        return Operation.GENERATE;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println("--- " + result.stackName());
        System.out.println(result.output());
    }
}
