package com.deepansh.react.tool.impl;

import com.deepansh.react.tool.AgentTool;
import com.deepansh.react.tool.ToolRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Catalog entry for the finish action. Listed so the model can see its syntax;
 * the loop ends the run itself when it sees this action and never invokes it.
 */
@Component
public class FinishTool implements AgentTool {

    @Override
    public String getName() {
        return ToolRegistry.FINISH;
    }

    @Override
    public String getDescription() {
        return "Provide the final answer and end the task";
    }

    @Override
    public String getUsage() {
        return "finish[final answer]";
    }

    @Override
    public List<String> getExamples() {
        return List.of("finish[1,800 to 7,000 ft]", "finish[Harry Styles, 29 years old]");
    }

    @Override
    public String invoke(String input) {
        throw new IllegalStateException("finish is handled by the agent loop and cannot be invoked");
    }
}
