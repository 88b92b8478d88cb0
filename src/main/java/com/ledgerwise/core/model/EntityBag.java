package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of entities extracted from one request. At most one value per
 * {@link EntityKind}; blank values are dropped on construction.
 *
 * @param values extracted values keyed by kind
 */
public record EntityBag(Map<EntityKind, String> values) implements Serializable {

    public EntityBag {
        var copy = new EnumMap<EntityKind, String>(EntityKind.class);
        if (values != null) {
            values.forEach((kind, value) -> {
                if (kind != null && value != null && !value.isBlank()) {
                    copy.put(kind, value.trim());
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static EntityBag empty() {
        return new EntityBag(Map.of());
    }

    public Optional<String> get(EntityKind kind) {
        return Optional.ofNullable(values.get(kind));
    }

    public boolean has(EntityKind kind) {
        return values.containsKey(kind);
    }

    /** Value for a tool parameter, if some entity kind feeds it. */
    public Optional<String> forParameter(String parameter) {
        return EntityKind.forParameter(parameter).flatMap(this::get);
    }

    public EntityBag with(EntityKind kind, String value) {
        var copy = new EnumMap<EntityKind, String>(EntityKind.class);
        copy.putAll(values);
        copy.put(kind, value);
        return new EntityBag(copy);
    }

    public EntityBag without(EntityKind kind) {
        var copy = new EnumMap<EntityKind, String>(EntityKind.class);
        copy.putAll(values);
        copy.remove(kind);
        return new EntityBag(copy);
    }

    /**
     * Returns a bag holding this bag's values, with gaps filled from
     * {@code fallback}.
     */
    public EntityBag orElse(EntityBag fallback) {
        var copy = new EnumMap<EntityKind, String>(EntityKind.class);
        copy.putAll(fallback.values);
        copy.putAll(values);
        return new EntityBag(copy);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }
}
