package com.deepansh.react.tool;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Immutable snapshot of a tool's catalog entry.
 * Used for prompt rendering and the tools endpoint, never for invocation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private String usage;
    private List<String> examples;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .usage(tool.getUsage())
                .examples(List.copyOf(tool.getExamples()))
                .build();
    }

    /** Single prompt line: {@code name: description (usage: name[input])} */
    public String toPromptLine() {
        return name + ": " + description + " (usage: " + usage + ")";
    }
}
