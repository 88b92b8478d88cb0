package com.ledgerwise.core.model;

/**
 * What invoking a tool does to the outside world.
 */
public enum SideEffect {
    /** Reads only. */
    READ_ONLY,
    /** Writes, but a repeated call with the same key finds the earlier write. */
    IDEMPOTENT_BY_KEY,
    /** Writes with no deduplication. */
    MUTATING;

    public boolean safeToRepeat() {
        return this != MUTATING;
    }
}
