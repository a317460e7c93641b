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

/**
 * CLI command: stackforge validate [path]
 * <p>
 * Renders each template and has the provider validate it. Values that cannot
 * be resolved yet, such as outputs of stacks not launched, are replaced by
 * placeholders unless {@code --no-placeholders} is given.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate the templates of stacks")
@Component
public class ValidateCommand extends PlanCommand {

    @Option(names = "--no-placeholders", description = "Fail on unresolvable values instead of using placeholders")
    private boolean noPlaceholders;

    public ValidateCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected PlanResult run(String path, PlanOptions options) {
        return super.run(path, options.withPlaceholders(!noPlaceholders));
    }

    @Override
    protected Operation operation() {
        return Operation.VALIDATE;
    }

    @Override
    protected void printOutput(StackResult result) {
        System.out.println("--- " + result.stackName());
        System.out.print(Yaml.write(result.output()));
    }
}
