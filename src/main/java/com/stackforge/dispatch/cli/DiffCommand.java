package com.stackforge.dispatch.cli;

import com.stackforge.core.diff.Difference;
import com.stackforge.core.diff.StackDiff;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: stackforge diff [path]
 * <p>
 * Shows how each stack's local definition differs from what is deployed.
 */
@Command(name = "diff", mixinStandardHelpOptions = true,
        description = "Compare the local definition of stacks with the deployed stacks")
@Component
public class DiffCommand extends PlanCommand {

    private static final String BAR = "*".repeat(60);

    public DiffCommand(PlanService planService, EventBus eventBus) {
        super(planService, eventBus);
    }

    @Override
    protected Operation operation() {
        return Operation.DIFF;
    }

    @Override
    protected void printOutput(StackResult result) {
        StackDiff diff = (StackDiff) result.output();
        System.out.println(BAR);
        if (!diff.hasDifference()) {
            System.out.println("No difference to deployed stack " + diff.stackName());
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold ==> Difference detected for stack " + diff.stackName() + "|@"));
        if (!diff.deployed()) {
            System.out.println("This stack is not deployed yet. New config:");
            System.out.print(Yaml.write(diff.generatedConfig()));
            return;
        }
        print("Config difference", diff.configDiff());
        print("Template difference", diff.templateDiff());
    }

    private static void print(String title, List<Difference> differences) {
        System.out.println(title + ":" + (differences.isEmpty() ? " none" : ""));
        for (Difference difference : differences) {
            String line = switch (difference.kind()) {
                case ADDED -> "@|fg(green) + " + difference.path() + ": " + difference.generated() + "|@";
                case REMOVED -> "@|fg(red) - " + difference.path() + ": " + difference.deployed() + "|@";
                case CHANGED -> "@|fg(yellow) ~ " + difference.path() + ": " + difference.deployed()
                        + " -> " + difference.generated() + "|@";
            };
            System.out.println("  " + CommandLine.Help.Ansi.AUTO.string(line));
        }
    }
}
