package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of classifying a request.
 *
 * @param intent   coarse request category
 * @param entities entities extracted from the request text
 * @param facets   individual things asked for; may be empty
 */
public record Classification(
    Intent intent,
    EntityBag entities,
    Set<TaskFacet> facets
) implements Serializable {

    public Classification {
        if (intent == null) {
            intent = Intent.COMPOSITE_TASK;
        }
        if (entities == null) {
            entities = EntityBag.empty();
        }
        var copy = EnumSet.noneOf(TaskFacet.class);
        if (facets != null) {
            copy.addAll(facets);
        }
        facets = Collections.unmodifiableSet(copy);
    }
}
