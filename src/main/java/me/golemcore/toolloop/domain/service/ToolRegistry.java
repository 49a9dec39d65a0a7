package me.golemcore.toolloop.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.component.ToolComponent;
import me.golemcore.toolloop.domain.model.ToolDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, read-only set of tools exposed to the LLM.
 *
 * <p>
 * Names are unique; registration order is the order of the published schema
 * set. The registry never changes after construction, so one instance is shared
 * by every concurrently running tool loop invocation without locking.
 */
@Slf4j
public final class ToolRegistry {

    private final Map<String, ToolComponent> tools;
    private final List<ToolDefinition> definitions;

    public ToolRegistry(Collection<? extends ToolComponent> tools) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        if (tools != null) {
            for (ToolComponent tool : tools) {
                String name = resolveToolName(tool);
                if (byName.putIfAbsent(name, tool) != null) {
                    throw new IllegalArgumentException("Duplicate tool name: " + name);
                }
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        this.definitions = byName.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
        log.debug("[Tools] Registry built with {} tools: {}", byName.size(), byName.keySet());
    }

    public static ToolRegistry of(ToolComponent... tools) {
        return new ToolRegistry(List.of(tools));
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(List.of());
    }

    /**
     * Returns the schema set of enabled tools, in registration order.
     */
    public List<ToolDefinition> getDefinitions() {
        return definitions;
    }

    /**
     * Resolves an enabled tool by exact name.
     */
    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ToolComponent tool = tools.get(name);
        if (tool == null || !tool.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(tool);
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    public int size() {
        return tools.size();
    }

    private static String resolveToolName(ToolComponent tool) {
        if (tool == null) {
            throw new IllegalArgumentException("Tool must not be null");
        }
        ToolDefinition definition = tool.getDefinition();
        if (definition == null) {
            throw new IllegalArgumentException("Tool has no definition: " + tool.getClass().getName());
        }
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank: " + tool.getClass().getName());
        }
        return name;
    }
}
