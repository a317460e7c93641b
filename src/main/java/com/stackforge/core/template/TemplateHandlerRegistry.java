package com.stackforge.core.template;

import com.stackforge.core.model.InvalidConfigurationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup table from template type to handler.
 */
public class TemplateHandlerRegistry {

    public static final String DEFAULT_TYPE = FileTemplateHandler.TYPE;

    private final Map<String, TemplateHandler> handlers = new LinkedHashMap<>();

    public TemplateHandlerRegistry(Collection<? extends TemplateHandler> handlers) {
        for (TemplateHandler handler : handlers) {
            if (this.handlers.putIfAbsent(handler.type(), handler) != null) {
                throw new InvalidConfigurationException("A template handler is already registered for type '"
                        + handler.type() + "'");
            }
        }
    }

    public TemplateHandler handler(String type) {
        TemplateHandler handler = handlers.get(type == null ? DEFAULT_TYPE : type);
        if (handler == null) {
            throw new TemplateException("No template handler for type '" + type
                    + "' (available: " + String.join(", ", handlers.keySet()) + ")");
        }
        return handler;
    }
}
