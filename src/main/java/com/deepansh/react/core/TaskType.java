package com.deepansh.react.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Task profiles a run can be started with. The preferred tools and the typical
 * thought count only shape the prompt; the loop does not enforce them.
 */
public enum TaskType {

    KNOWLEDGE("knowledge", "Knowledge-intensive",
            "Question answering and fact verification that needs external knowledge",
            List.of("search", "knowledge", "lookup", "finish"), 3),

    DECISION("decision", "Decision making",
            "Complex tasks that need planning and decisions",
            List.of("search", "calculator", "lookup", "finish"), 2),

    REASONING("reasoning", "Reasoning",
            "Problems that need logical reasoning and calculation",
            List.of("calculator", "knowledge", "search", "finish"), 4),

    GENERAL("general", "General",
            "Mixed questions of any kind",
            List.of("search", "calculator", "knowledge", "lookup", "finish"), 3);

    private final String code;
    private final String label;
    private final String description;
    private final List<String> preferredTools;
    private final int typicalThoughts;

    TaskType(String code, String label, String description, List<String> preferredTools, int typicalThoughts) {
        this.code = code;
        this.label = label;
        this.description = description;
        this.preferredTools = preferredTools;
        this.typicalThoughts = typicalThoughts;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getPreferredTools() {
        return preferredTools;
    }

    public int getTypicalThoughts() {
        return typicalThoughts;
    }

    @JsonCreator
    public static TaskType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown taskType '" + code + "'. Expected one of: knowledge, decision, reasoning, general"));
    }
}
