package com.stackforge.core.template;

import com.stackforge.core.model.Stack;

import java.util.Map;

/**
 * Produces the infrastructure description of a stack. The engine treats the
 * result as an opaque payload.
 */
public interface TemplateHandler {

    /** Value of the {@code type} key selecting this handler. */
    String type();

    /**
     * @param stack     the stack being deployed
     * @param arguments materialized handler arguments, without {@code type}
     * @param userData  materialized {@code user_data} of the stack
     * @return the template body
     * @throws TemplateException when the template cannot be produced
     */
    String render(Stack stack, Map<String, Object> arguments, Map<String, Object> userData);
}
