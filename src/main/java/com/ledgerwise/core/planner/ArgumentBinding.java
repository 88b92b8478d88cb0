package com.ledgerwise.core.planner;

import com.ledgerwise.core.model.ArgumentValue;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.ToolSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Eager binding of tool parameters from request entities.
 */
final class ArgumentBinding {

    private ArgumentBinding() {}

    /**
     * Required parameters become literals when the entity bag has a value and
     * {@link ArgumentValue.Unbound} otherwise. Optional parameters are bound
     * only when the bag has a value.
     */
    static Map<String, ArgumentValue> fromEntities(ToolSpec spec, EntityBag entities) {
        var arguments = new LinkedHashMap<String, ArgumentValue>();
        for (String parameter : spec.requiredParameters()) {
            arguments.put(parameter, entities.forParameter(parameter)
                    .map(ArgumentValue::literal)
                    .orElse(ArgumentValue.UNBOUND));
        }
        for (String parameter : spec.optionalParameters()) {
            entities.forParameter(parameter)
                    .ifPresent(value -> arguments.put(parameter, ArgumentValue.literal(value)));
        }
        return arguments;
    }
}
