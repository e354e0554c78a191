package dev.nova.engine;

import dev.nova.tools.Tool;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps tool names to capabilities. Built once at startup; lookups never retry or wrap.
 */
public final class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(Collection<? extends Tool> tools) {
        tools.forEach(this::register);
    }

    public static ToolRegistry of(Tool... tools) {
        return new ToolRegistry(List.of(tools));
    }

    private void register(Tool tool) {
        String name = tool.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must be non-empty: " + tool.getClass().getName());
        }
        if (tools.putIfAbsent(name, tool) != null) {
            throw new IllegalArgumentException("Duplicate tool name: " + name);
        }
    }

    /**
     * Look up a capability by name.
     *
     * @throws UnknownToolException if no tool is registered under {@code name}
     */
    public Tool resolve(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    /** Registered names in registration order. */
    public List<String> names() {
        return List.copyOf(tools.keySet());
    }
}
