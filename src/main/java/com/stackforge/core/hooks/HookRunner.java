package com.stackforge.core.hooks;

import com.stackforge.core.model.Stack;
import com.stackforge.core.resolver.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the hooks configured for one hook point of a stack, in order.
 */
public final class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private HookRunner() {
    }

    /**
     * @throws HookException on the first failing hook; later hooks do not run
     */
    public static void run(Stack stack, String hookPoint, ResolutionContext context) {
        List<Hook> hooks = stack.hooks(hookPoint);
        for (Hook hook : hooks) {
            log.debug("{} - Running {} hook {}", stack.name(), hookPoint, hook);
            try {
                hook.run(context);
            } catch (HookException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new HookException(hookPoint + " hook " + hook + " failed: " + e.getMessage(), e);
            }
        }
    }
}
