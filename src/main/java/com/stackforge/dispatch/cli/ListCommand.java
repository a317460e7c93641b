package com.stackforge.dispatch.cli;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.model.Stack;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stackforge list [path]
 * <p>
 * Lists the stacks a command over the same path would run, in execution order,
 * without calling the provider.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List stacks in execution order")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    PlanArguments arguments;

    private final PlanService planService;

    public ListCommand(PlanService planService) {
        this.planService = planService;
    }

    @Override
    public Integer call() {
        List<Stack> stacks;
        try {
            stacks = planService.list(arguments.path, arguments.toOptions());
        } catch (StackforgeException e) {
            ConsoleOutput.error(e.getMessage());
            return PlanCommand.EXIT_FAILED;
        }
        System.out.printf("  %-40s %-40s %s%n", "STACK", "EXTERNAL NAME", "DEPENDENCIES");
        System.out.println("  " + "-".repeat(96));
        for (Stack stack : stacks) {
            System.out.printf("  %-40s %-40s %s%n", stack.name(), stack.externalName(),
                    stack.dependencies().isEmpty() ? "-" : String.join(", ", stack.dependencies()));
        }
        return PlanCommand.EXIT_OK;
    }
}
