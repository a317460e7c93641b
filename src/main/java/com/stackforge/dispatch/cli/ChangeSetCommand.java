package com.stackforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command group: stackforge change-set &lt;create|describe|execute|delete|list&gt;
 */
@Command(
        name = "change-set",
        mixinStandardHelpOptions = true,
        description = "Create, review, execute and delete change sets",
        subcommands = {
                CreateChangeSetCommand.class,
                DescribeChangeSetCommand.class,
                ExecuteChangeSetCommand.class,
                DeleteChangeSetCommand.class,
                ListChangeSetsCommand.class
        }
)
@Component
public class ChangeSetCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }
}
