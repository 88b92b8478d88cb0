package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static description of a registered tool.
 *
 * @param name               unique registry key, e.g. {@code employee_lookup}
 * @param title              human-readable name used in answers
 * @param description        one-line description shown by {@code ledgerwise tools}
 * @param requiredParameters parameters that must be bound before invocation
 * @param optionalParameters parameters the tool accepts but does not need
 * @param defaults           default values for some optional parameters
 * @param exports            output fields later steps may reference
 * @param category           answer section the tool's output belongs to
 * @param sideEffect         whether repeating a call is safe
 */
public record ToolSpec(
    String name,
    String title,
    String description,
    List<String> requiredParameters,
    List<String> optionalParameters,
    Map<String, String> defaults,
    List<String> exports,
    ToolCategory category,
    SideEffect sideEffect
) implements Serializable {

    public ToolSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        requiredParameters = requiredParameters == null ? List.of() : List.copyOf(requiredParameters);
        optionalParameters = optionalParameters == null ? List.of() : List.copyOf(optionalParameters);
        defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        exports = exports == null ? List.of() : List.copyOf(exports);
        for (String parameter : defaults.keySet()) {
            if (!optionalParameters.contains(parameter)) {
                throw new IllegalArgumentException(
                        "Tool " + name + " declares a default for unknown optional parameter " + parameter);
            }
        }
    }

    public boolean requires(String parameter) {
        return requiredParameters.contains(parameter);
    }

    public boolean accepts(String parameter) {
        return requiredParameters.contains(parameter) || optionalParameters.contains(parameter);
    }

    public boolean exportsParameter(String parameter) {
        return exports.contains(parameter);
    }

    public Optional<String> defaultFor(String parameter) {
        return Optional.ofNullable(defaults.get(parameter));
    }
}
