package com.ledgerwise.core.model;

/**
 * Lifecycle of a plan step.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_TERMINAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }
}
