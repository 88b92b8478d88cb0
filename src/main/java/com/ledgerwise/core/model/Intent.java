package com.ledgerwise.core.model;

import java.util.Locale;

/**
 * Coarse category of a user request. Selects the family of tools the planner
 * draws from.
 */
public enum Intent {
    SIMPLE_LOOKUP,
    DATA_QUERY,
    COMPOSITE_TASK,
    CONTENT_GENERATION;

    /**
     * Maps a free-form classifier label onto an intent. Unknown, blank or
     * missing labels fall back to {@link #COMPOSITE_TASK}, the family with the
     * widest tool coverage.
     */
    public static Intent fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return COMPOSITE_TASK;
        }
        String normalized = label.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return COMPOSITE_TASK;
    }
}
