package com.ledgerwise.core.model;

import java.io.Serializable;

/**
 * A classified step failure.
 *
 * @param kind      failure class
 * @param message   detail message
 * @param parameter offending parameter, if the failure is about one; nullable
 */
public record StepError(
    ErrorKind kind,
    String message,
    String parameter
) implements Serializable {

    public static StepError of(ErrorKind kind, String message) {
        return new StepError(kind, message, null);
    }
}
