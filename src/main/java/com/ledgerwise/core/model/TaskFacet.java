package com.ledgerwise.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The individual things a request asks for. One request can carry several,
 * e.g. "summarise Alice's March claims and email them to her" is
 * {@link #EXPENSE_SUMMARY} plus {@link #EMAIL}.
 */
public enum TaskFacet {
    POLICY,
    EMPLOYEE_PROFILE,
    EXPENSE_SUMMARY,
    EXPENSE_STATUS,
    EXPENSE_RECORDS,
    DRAFT,
    WORK_ORDER,
    EMAIL;

    public static Optional<TaskFacet> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TaskFacet facet : values()) {
            if (facet.name().equals(normalized)) {
                return Optional.of(facet);
            }
        }
        return Optional.empty();
    }
}
