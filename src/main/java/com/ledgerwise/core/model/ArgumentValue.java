package com.ledgerwise.core.model;

import java.io.Serializable;

/**
 * How a single plan step argument gets its value.
 */
public interface ArgumentValue extends Serializable {

    /** A value known at planning time. */
    record Literal(String value) implements ArgumentValue {}

    /** The named export of an earlier step, read at execution time. */
    record BackReference(String stepId, String export) implements ArgumentValue {}

    /** Nothing bound yet; the resolver or the executor fills it in. */
    record Unbound() implements ArgumentValue {}

    ArgumentValue UNBOUND = new Unbound();

    static ArgumentValue literal(String value) {
        return new Literal(value);
    }

    static ArgumentValue reference(String stepId, String export) {
        return new BackReference(stepId, export);
    }

    default boolean isBound() {
        return !(this instanceof Unbound);
    }
}
