package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.StepError;

/**
 * A classified tool failure.
 */
public class ToolInvocationException extends Exception {

    private final ErrorKind kind;
    private final String parameter;

    public ToolInvocationException(ErrorKind kind, String message) {
        this(kind, message, (String) null);
    }

    public ToolInvocationException(ErrorKind kind, String message, String parameter) {
        super(message);
        this.kind = kind;
        this.parameter = parameter;
    }

    public ToolInvocationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.parameter = null;
    }

    public static ToolInvocationException invalid(String parameter, String message) {
        return new ToolInvocationException(ErrorKind.PARAMETER_INVALID, message, parameter);
    }

    public static ToolInvocationException notFound(String message) {
        return new ToolInvocationException(ErrorKind.ENTITY_NOT_FOUND, message);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String parameter() {
        return parameter;
    }

    public StepError toStepError() {
        return new StepError(kind, getMessage(), parameter);
    }
}
