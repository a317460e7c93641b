package com.stackforge.core.hooks;

import com.stackforge.core.model.Stack;
import com.stackforge.core.provider.ConnectionManager;
import com.stackforge.core.resolver.ResolutionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.stackforge.core.model.TestStacks.stack;
import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class CmdHookTest {

    private static void run(CmdHook hook) {
        Stack stack = stack("dev/app", Map.of(Stack.HOOKS, Map.of("before_create", List.of(hook))));
        hook.run(new ResolutionContext(Map.of(stack.name(), stack), new ConnectionManager(key -> null), false));
    }

    @Test
    @DisplayName("runs the command with the stack in its environment")
    void runsCommand(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out.txt");
        run(new CmdHook("echo \"$STACKFORGE_STACK $STACKFORGE_STACK_NAME\" > " + out));

        assertEquals("dev/app test-dev-app", Files.readString(out).trim());
    }

    @Test
    @DisplayName("accepts a command and shell mapping")
    void commandAndShell(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out.txt");
        run(new CmdHook(Map.of("command", "echo ok > " + out, "shell", "/bin/sh")));

        assertEquals("ok", Files.readString(out).trim());
    }

    @Test
    @DisplayName("a non-zero exit status fails the hook")
    void nonZeroExit() {
        var e = assertThrows(HookException.class, () -> run(new CmdHook("exit 3")));
        assertTrue(e.getMessage().contains("status 3"));
    }

    @Test
    @DisplayName("an argument that is neither a string nor a command mapping is rejected")
    void invalidArgument() {
        assertThrows(InvalidHookArgumentException.class, () -> run(new CmdHook(List.of("echo"))));
        assertThrows(InvalidHookArgumentException.class, () -> run(new CmdHook(Map.of("command", "echo"))));
    }
}
