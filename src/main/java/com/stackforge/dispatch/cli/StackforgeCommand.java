package com.stackforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for stackforge.
 */
@Command(
        name = "stackforge",
        mixinStandardHelpOptions = true,
        version = "stackforge 0.1.0",
        description = "Dependency-aware deployment of infrastructure stacks",
        subcommands = {
                LaunchCommand.class,
                CreateCommand.class,
                UpdateCommand.class,
                DeleteCommand.class,
                PruneCommand.class,
                StatusCommand.class,
                OutputsCommand.class,
                ValidateCommand.class,
                GenerateCommand.class,
                DumpConfigCommand.class,
                DiffCommand.class,
                DescribeEventsCommand.class,
                DescribeResourcesCommand.class,
                ChangeSetCommand.class,
                ListCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StackforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
