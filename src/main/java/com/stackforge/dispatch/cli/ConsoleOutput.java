package com.stackforge.dispatch.cli;

import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.StackforgeEvent;
import com.stackforge.core.model.StackResult;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the stackforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STACKFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STACKFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(StackforgeEvent event) {
        Object operation = event.payload().get("operation");
        String line = switch (event.eventType()) {
            case StackforgeEvent.PLAN_STARTED -> "@|fg(cyan) [PLAN]|@ " + operation + " on "
                    + event.payload().get("stacks") + " stack(s)";
            case StackforgeEvent.STACK_STARTED -> "@|fg(blue) [STACK]|@ " + event.stackName() + " " + operation;
            case StackforgeEvent.STACK_COMPLETED -> "@|fg(green) [STACK]|@ " + event.stackName() + " "
                    + event.payload().getOrDefault("status", "COMPLETE");
            case StackforgeEvent.STACK_FAILED -> "@|fg(red) [STACK]|@ " + event.stackName() + " "
                    + event.payload().get("reason") + ": " + event.payload().get("message");
            case StackforgeEvent.STACK_SKIPPED -> "@|fg(yellow) [SKIP]|@ " + event.stackName() + " "
                    + event.payload().get("message");
            case StackforgeEvent.PLAN_COMPLETED -> "@|fg(cyan) [PLAN]|@ " + operation + " finished";
            default -> "@|fg(white) [" + event.eventType() + "]|@ " + event.payload();
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void summary(PlanResult result) {
        System.out.println("──────────────────────────────────");
        for (StackResult stack : result.results().values()) {
            if (stack.isSuccessful()) {
                success(stack.stackName() + " " + (stack.status() == null ? "COMPLETE" : stack.status())
                        + (stack.hasRun() ? " (" + formatDuration(stack.durationMs()) + ")" : ""));
            } else {
                error(stack.stackName() + " " + stack.failureReason() + ": " + stack.message());
            }
        }
        int failed = result.failures().size();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + result.operation().verb() + "|@: @|fg(green) " + result.successes().size()
                        + " complete|@" + (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")
                        + " in " + formatDuration(Duration.between(result.startedAt(),
                        result.finishedAt()).toMillis())));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
