package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a tool returns on success.
 *
 * @param summary    human-readable result, used as the answer excerpt
 * @param data       structured result fields
 * @param exports    values later steps may back-reference, by export name
 * @param origin     source identifier for attribution, e.g. {@code employees/E001}; nullable
 * @param confidence retrieval score or similar; nullable
 */
public record ToolOutput(
    String summary,
    Map<String, Object> data,
    Map<String, Object> exports,
    String origin,
    Double confidence
) implements Serializable {

    public ToolOutput {
        summary = summary == null ? "" : summary;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        exports = exports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(exports));
    }

    public static ToolOutput of(String summary, Map<String, Object> exports, String origin) {
        return new ToolOutput(summary, Map.of(), exports, origin, null);
    }
}
