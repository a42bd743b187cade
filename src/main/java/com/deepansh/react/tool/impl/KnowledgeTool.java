package com.deepansh.react.tool.impl;

import com.deepansh.react.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Simulated knowledge base lookup.
 */
@Component
public class KnowledgeTool implements AgentTool {

    private static final Map<String, String> ENTRIES = Map.of(
            "elevation",
            "Elevation is usually given in metres above sea level; it varies widely between regions.",
            "historical events",
            "Historical events need a specific time, place and people to be looked up accurately.",
            "people",
            "Looking up a person requires their full name and what you want to know about them."
    );

    @Override
    public String getName() {
        return "knowledge";
    }

    @Override
    public String getDescription() {
        return "Query domain knowledge and facts";
    }

    @Override
    public String getUsage() {
        return "knowledge[topic]";
    }

    @Override
    public List<String> getExamples() {
        return List.of("knowledge[elevation]", "knowledge[historical events]");
    }

    @Override
    public String invoke(String input) {
        String topic = input == null ? "" : input.trim();
        String entry = ENTRIES.get(topic.toLowerCase());
        if (entry != null) {
            return entry;
        }
        return "Knowledge base entry for \"" + topic + "\": a related entry exists; a search is recommended for details.";
    }
}
