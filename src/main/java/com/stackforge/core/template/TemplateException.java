package com.stackforge.core.template;

import com.stackforge.core.StackforgeException;

/**
 * A template could not be located or rendered.
 */
public class TemplateException extends StackforgeException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
