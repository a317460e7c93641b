package com.stackforge.dispatch.cli;

import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.StackPlan;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Arguments shared by every command that runs over a command path.
 */
public class PlanArguments {

    @Spec(Spec.Target.MIXEE)
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", defaultValue = StackPlan.WHOLE_PROJECT,
            description = "Stack or group path relative to config/ (default: whole project)")
    String path;

    @Option(names = "--ignore-dependencies",
            description = "Run only the selected stacks, without their dependencies")
    boolean ignoreDependencies;

    int maxConcurrency;

    @Option(names = "--max-concurrency", defaultValue = "0",
            description = "Maximum number of stacks running at once (default: configured value)")
    void setMaxConcurrency(int maxConcurrency) {
        if (maxConcurrency < 0) {
            throw new ParameterException(spec.commandLine(),
                    "--max-concurrency must be 0 or more, was " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
    }

    PlanOptions toOptions() {
        return new PlanOptions(ignoreDependencies, maxConcurrency, false, false);
    }
}
