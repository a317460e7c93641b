package com.stackforge.core.diff;

/**
 * One difference between the deployed and the generated version of a value.
 *
 * @param path      dotted path to the value; list items as {@code name[index]}, empty for the root
 * @param kind      what happened to the value
 * @param deployed  the deployed value, null when added
 * @param generated the generated value, null when removed
 */
public record Difference(String path, Kind kind, Object deployed, Object generated) {

    public enum Kind {
        ADDED,
        REMOVED,
        CHANGED
    }
}
