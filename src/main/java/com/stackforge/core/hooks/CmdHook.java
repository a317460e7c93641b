package com.stackforge.core.hooks;

import com.stackforge.core.resolver.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code !cmd}: runs a command through a shell. The argument is either the
 * command string or a mapping with {@code command} and {@code shell} keys.
 * A non-zero exit status fails the hook.
 */
public class CmdHook extends AbstractHook {

    public static final String TAG = "cmd";

    private static final Logger log = LoggerFactory.getLogger(CmdHook.class);
    private static final String DEFAULT_SHELL = "/bin/sh";

    public CmdHook(Object argument) {
        super(TAG, argument);
    }

    @Override
    public void run(ResolutionContext context) {
        Object argument = resolveArgument(context);
        String command;
        String shell;
        if (argument instanceof String value && !value.isBlank()) {
            command = value;
            shell = DEFAULT_SHELL;
        } else if (argument instanceof Map<?, ?> map
                && map.keySet().equals(Set.of("command", "shell"))
                && map.get("command") instanceof String c
                && map.get("shell") instanceof String s) {
            command = c;
            shell = s;
        } else {
            throw new InvalidHookArgumentException("A cmd hook requires either a string argument or an object with "
                    + "`command` and `shell` keys with string values. You gave `" + argument + "`.");
        }
        execute(List.of(shell, "-c", command));
    }

    private void execute(List<String> commandLine) {
        var builder = new ProcessBuilder(commandLine).redirectErrorStream(true);
        builder.environment().putAll(environment());
        try {
            Process process = builder.start();
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("{} - {}", stack().name(), line);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new HookException("Command `" + commandLine.get(2) + "` exited with status " + exitCode);
            }
        } catch (IOException e) {
            throw new HookException("Could not run command `" + commandLine.get(2) + "`: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HookException("Interrupted while running command `" + commandLine.get(2) + "`", e);
        }
    }

    private Map<String, String> environment() {
        var env = new HashMap<String, String>();
        env.put("STACKFORGE_STACK", stack().name());
        env.put("STACKFORGE_STACK_NAME", stack().externalName());
        if (stack().region() != null) {
            env.put("STACKFORGE_REGION", stack().region());
        }
        if (stack().profile() != null) {
            env.put("STACKFORGE_PROFILE", stack().profile());
        }
        return env;
    }
}
