package com.ledgerwise.core.model;

/**
 * Classification of a step failure. Drives the retry decision and the
 * plain-language reason reported back to the user.
 */
public enum ErrorKind {
    PARAMETER_INVALID(true, "some of the details provided were not valid"),
    ENTITY_NOT_FOUND(false, "the requested record could not be found"),
    DEPENDENCY_UNSATISFIABLE(false, "the request is missing information that no available tool can supply"),
    TRANSIENT(true, "a service was temporarily unavailable"),
    EXTERNAL_MUTATION_UNCERTAIN(false, "the action may have been partly applied and needs a manual check"),
    PRECONDITION_FAILED(false, "skipped because an earlier step it depends on did not succeed"),
    INTERNAL_FAULT(false, "an internal error occurred");

    private final boolean retryable;
    private final String reason;

    ErrorKind(boolean retryable, String reason) {
        this.retryable = retryable;
        this.reason = reason;
    }

    public boolean retryable() {
        return retryable;
    }

    public String reason() {
        return reason;
    }

    /**
     * Whether the detail message of this kind is written for the user. Other
     * kinds may carry infrastructure detail and are reported by reason only.
     */
    public boolean userFacingDetail() {
        return this == PARAMETER_INVALID || this == ENTITY_NOT_FOUND
                || this == DEPENDENCY_UNSATISFIABLE || this == PRECONDITION_FAILED;
    }
}
