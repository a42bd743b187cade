package com.deepansh.react.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only catalog of every AgentTool implementation.
 *
 * Spring auto-discovers every @Component that implements AgentTool
 * and injects them as a List<AgentTool>. The index is built once here and
 * never changes afterwards, so concurrent runs can share it freely.
 */
@Component
@Slf4j
public class ToolRegistry {

    /** Reserved action name that ends a run */
    public static final String FINISH = "finish";

    private final Map<String, AgentTool> tools;

    public ToolRegistry(List<AgentTool> toolBeans) {
        Map<String, AgentTool> index = new LinkedHashMap<>();
        toolBeans.forEach(tool -> {
            AgentTool previous = index.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]: {}", tool.getName(), tool.getDescription());
        });
        this.tools = Map.copyOf(index);
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<AgentTool> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .map(ToolDefinition::from)
                .toList();
    }

    /** Definitions for the given names, in the given order. Unknown names are skipped. */
    public List<ToolDefinition> getDefinitions(Collection<String> names) {
        return names.stream()
                .map(tools::get)
                .filter(t -> t != null)
                .map(ToolDefinition::from)
                .toList();
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    public int toolCount() {
        return tools.size();
    }
}
