package com.stackforge.core.plan;

import com.stackforge.core.model.InvalidConfigurationException;

public class CannotPruneStackException extends InvalidConfigurationException {

    public CannotPruneStackException(String obsolete, String dependent) {
        super("Cannot prune obsolete stack " + obsolete + " because stack " + dependent
                + " depends on it but is not obsolete");
    }
}
