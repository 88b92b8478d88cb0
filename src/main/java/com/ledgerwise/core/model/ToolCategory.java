package com.ledgerwise.core.model;

/**
 * Grouping of tools for the sections of an aggregated answer. Declaration
 * order is section order.
 */
public enum ToolCategory {
    POLICY("Policy information"),
    DATA("Records"),
    ACTION("Actions taken"),
    GENERATION("Generated content");

    private final String heading;

    ToolCategory(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }
}
