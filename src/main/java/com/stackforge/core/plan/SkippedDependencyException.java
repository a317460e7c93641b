package com.stackforge.core.plan;

import com.stackforge.core.model.InvalidConfigurationException;

/**
 * A stack that a launch skips (ignored or obsolete) is needed by a stack
 * the launch would run.
 */
public class SkippedDependencyException extends InvalidConfigurationException {

    public SkippedDependencyException(String stackName, String skipped, String flag) {
        super("Stack '" + stackName + "' depends on '" + skipped + "', which is marked " + flag
                + " and would be skipped by launch");
    }
}
