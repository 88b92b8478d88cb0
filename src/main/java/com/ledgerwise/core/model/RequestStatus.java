package com.ledgerwise.core.model;

/**
 * Lifecycle of a request through the orchestration graph.
 */
public enum RequestStatus {
    RECEIVED,
    CLASSIFIED,
    PLANNED,
    RESOLVED,
    EXECUTING,
    AGGREGATED,
    DONE,
    REJECTED,
    FAULTED
}
