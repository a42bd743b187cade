package com.deepansh.react.tool.impl;

import com.deepansh.react.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Simulated in-document lookup (the "Lookup" action of the ReAct paper).
 */
@Component
public class LookupTool implements AgentTool {

    @Override
    public String getName() {
        return "lookup";
    }

    @Override
    public String getDescription() {
        return "Find specific information in the current document or data";
    }

    @Override
    public String getUsage() {
        return "lookup[keyword]";
    }

    @Override
    public List<String> getExamples() {
        return List.of("lookup[eastern sector]", "lookup[elevation]");
    }

    @Override
    public String invoke(String input) {
        String keyword = input == null ? "" : input.trim();
        return "Lookup \"" + keyword + "\": found related information in the current document, continue the analysis from context.";
    }
}
