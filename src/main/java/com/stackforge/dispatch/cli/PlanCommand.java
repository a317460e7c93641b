package com.stackforge.dispatch.cli;

import com.stackforge.core.StackforgeException;
import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.StackResult;
import com.stackforge.core.plan.PlanOptions;
import com.stackforge.core.plan.PlanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Base for commands that run one operation over a command path, print
 * progress as it happens and exit non-zero when any stack failed.
 */
abstract class PlanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    /** How long Ctrl-C waits for running stacks before the JVM exits. */
    static final Duration INTERRUPT_GRACE = Duration.ofMinutes(10);

    @Mixin
    PlanArguments arguments;

    protected final PlanService planService;
    private final EventBus eventBus;

    protected PlanCommand(PlanService planService, EventBus eventBus) {
        this.planService = planService;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        // closing the guard releases an interrupted JVM, so it wraps the reporting too
        try (InterruptGuard guard = InterruptGuard.install(planService::cancel, INTERRUPT_GRACE)) {
            return runAndReport();
        }
    }

    private int runAndReport() {
        try {
            PlanResult result;
            try (EventBus.Subscription ignored = eventBus.subscribeAll(ConsoleOutput::event)) {
                result = run(arguments.path, arguments.toOptions());
            }
            if (result == null) {
                return EXIT_FAILED;
            }
            result.results().values().stream()
                    .filter(r -> r.isSuccessful() && r.output() != null)
                    .forEach(this::printOutput);
            ConsoleOutput.summary(result);
            return result.isSuccessful() ? EXIT_OK : EXIT_FAILED;
        } catch (StackforgeException e) {
            log.debug("Command failed", e);
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * Runs the command. Returns null when the user declined to go on.
     */
    protected PlanResult run(String path, PlanOptions options) {
        return planService.execute(path, operation(), options);
    }

    protected abstract Operation operation();

    /** Prints what a successful stack returned. Nothing by default. */
    protected void printOutput(StackResult result) {
    }

    /**
     * Asks a yes/no question on the terminal unless {@code assumeYes} is set.
     */
    protected static boolean confirm(String question, boolean assumeYes) {
        if (assumeYes) {
            return true;
        }
        System.out.print(question + " [y/N] ");
        System.out.flush();
        try {
            String answer = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
            return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            throw new StackforgeException("Could not read confirmation: " + e.getMessage(), e);
        }
    }
}
