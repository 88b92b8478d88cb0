package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of available tools, keyed by name. Registration order is kept and
 * breaks ties when several tools export the same parameter.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(Collection<? extends Tool> tools) {
        for (Tool tool : tools) {
            String name = tool.spec().name();
            if (this.tools.putIfAbsent(name, tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
        }
        log.info("Tool registry initialized with {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public Optional<ToolSpec> lookup(String name) {
        return find(name).map(Tool::spec);
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    /** Tools that export {@code parameter}, in registration order. */
    public List<ToolSpec> toolsExporting(String parameter) {
        return tools.values().stream()
                .map(Tool::spec)
                .filter(spec -> spec.exportsParameter(parameter))
                .toList();
    }

    public List<ToolSpec> specs() {
        return tools.values().stream().map(Tool::spec).toList();
    }

    public int size() {
        return tools.size();
    }
}
