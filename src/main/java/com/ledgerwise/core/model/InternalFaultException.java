package com.ledgerwise.core.model;

/**
 * An invariant of the engine itself was broken, e.g. a plan names a tool that
 * is not registered. Never retried.
 */
public class InternalFaultException extends RuntimeException {

    public InternalFaultException(String message) {
        super(message);
    }

    public InternalFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
