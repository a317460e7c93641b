package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;

public class ProtectedStackException extends StackforgeException {

    public ProtectedStackException(String stackName) {
        super("Cannot perform action on '" + stackName + "': stack protection is currently enabled");
    }
}
