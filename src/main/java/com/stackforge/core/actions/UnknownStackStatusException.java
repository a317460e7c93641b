package com.stackforge.core.actions;

import com.stackforge.core.StackforgeException;

public class UnknownStackStatusException extends StackforgeException {

    public UnknownStackStatusException(String status) {
        super(status + " is unknown");
    }
}
