package com.ledgerwise.core.model;

import java.util.Optional;

/**
 * Kinds of entity the classifier can pull out of a request. Each kind feeds
 * the tool parameter of the same meaning.
 */
public enum EntityKind {
    EMPLOYEE_NAME("employee_name"),
    EMPLOYEE_ID("employee_id"),
    START_DATE("start_date"),
    END_DATE("end_date"),
    SUBJECT("subject"),
    RECIPIENT("to_email"),
    PRIORITY("priority"),
    CATEGORY("category"),
    STATUS("status");

    private final String parameterName;

    EntityKind(String parameterName) {
        this.parameterName = parameterName;
    }

    public String parameterName() {
        return parameterName;
    }

    /**
     * Finds the entity kind that feeds a tool parameter. {@code assignee_id}
     * is fed by the employee id as well.
     */
    public static Optional<EntityKind> forParameter(String parameter) {
        if ("assignee_id".equals(parameter)) {
            return Optional.of(EMPLOYEE_ID);
        }
        for (EntityKind kind : values()) {
            if (kind.parameterName.equals(parameter)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
