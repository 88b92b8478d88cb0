package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;

import java.util.Map;

/**
 * A capability the assistant can invoke. Implementations validate their own
 * arguments and report failures as {@link ToolInvocationException}s carrying
 * an {@link com.ledgerwise.core.model.ErrorKind}.
 */
public interface Tool {

    ToolSpec spec();

    /**
     * Invokes the tool.
     *
     * @param arguments bound argument values by parameter name; read-only
     * @return the tool's output
     * @throws ToolInvocationException for any classified failure
     */
    ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException;

    default String name() {
        return spec().name();
    }
}
