package com.stackforge.core.model;

import java.util.Arrays;

/**
 * Verbs that can be applied to a stack.
 * <p>
 * Reverse operations tear stacks down, so they run dependents first. The
 * change set operations other than {@link #LIST_CHANGE_SETS} act on one
 * change set named in the plan options.
 */
public enum Operation {
    CREATE("create", false, true),
    UPDATE("update", false, true),
    LAUNCH("launch", false, true),
    DELETE("delete", true, true),
    CANCEL_UPDATE("cancel_update", false, false),
    STATUS("status", false, false),
    DESCRIBE("describe", false, false),
    OUTPUTS("outputs", false, false),
    VALIDATE("validate", false, false),
    GENERATE("generate", false, false),
    DUMP_CONFIG("dump_config", false, false),
    DIFF("diff", false, false),
    DESCRIBE_EVENTS("describe_events", false, false),
    DESCRIBE_RESOURCES("describe_resources", false, false),
    CREATE_CHANGE_SET("create_change_set", false, false),
    DESCRIBE_CHANGE_SET("describe_change_set", false, false),
    EXECUTE_CHANGE_SET("execute_change_set", false, true),
    DELETE_CHANGE_SET("delete_change_set", false, false),
    LIST_CHANGE_SETS("list_change_sets", false, false);

    private final String verb;
    private final boolean reverse;
    private final boolean mutating;

    Operation(String verb, boolean reverse, boolean mutating) {
        this.verb = verb;
        this.reverse = reverse;
        this.mutating = mutating;
    }

    /** True for the operations that need a change set name. */
    public boolean needsChangeSet() {
        return this == CREATE_CHANGE_SET || this == DESCRIBE_CHANGE_SET
                || this == EXECUTE_CHANGE_SET || this == DELETE_CHANGE_SET;
    }

    public String verb() {
        return verb;
    }

    public boolean isReverse() {
        return reverse;
    }

    /** True for operations that change the stack on the provider side. */
    public boolean isMutating() {
        return mutating;
    }

    public String beforeHook() {
        return "before_" + verb;
    }

    public String afterHook() {
        return "after_" + verb;
    }

    public static Operation fromVerb(String verb) {
        return Arrays.stream(values())
                .filter(op -> op.verb.equals(verb))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + verb));
    }
}
