package com.deepansh.react.core;

import com.deepansh.react.model.ToolCallRecord;
import com.deepansh.react.tool.AgentTool;
import com.deepansh.react.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Routes a parsed action to its tool and records the outcome as a ToolCallRecord.
 *
 * Never throws. An unknown action or a failing tool becomes a failed record whose
 * output is fed back to the model as the step's observation.
 */
@Component
@Slf4j
public class ActionDispatcher {

    private final ToolRegistry toolRegistry;

    public ActionDispatcher(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    /** Dispatch against every registered tool. */
    public ToolCallRecord dispatch(String action, String actionInput) {
        return dispatch(action, actionInput, toolRegistry.toolNames());
    }

    /**
     * Dispatch against the tools offered to this run. A registered tool that was
     * not offered is treated the same as an unknown action.
     */
    public ToolCallRecord dispatch(String action, String actionInput, Collection<String> offeredTools) {
        long start = System.nanoTime();

        Optional<AgentTool> tool = offeredTools.contains(action)
                ? toolRegistry.lookup(action)
                : Optional.empty();

        if (tool.isEmpty() || ToolRegistry.FINISH.equals(action)) {
            String msg = String.format("Unknown action: %s. Available tools: %s", action, offeredTools);
            log.warn("Unknown action [{}] requested, offered tools: {}", action, offeredTools);
            return record(action, actionInput, msg, false, start);
        }

        log.info("Executing tool: [{}] with input: {}", action, actionInput);

        try {
            String output = tool.get().invoke(actionInput);
            log.debug("Tool [{}] returned: {}", action, output);
            return record(action, actionInput, output == null ? "" : output, true, start);
        } catch (Exception e) {
            log.warn("Tool [{}] failed: {}", action, e.getMessage(), e);
            return record(action, actionInput, "Tool execution failed: " + e.getMessage(), false, start);
        }
    }

    private static ToolCallRecord record(String action, String input, String output, boolean success, long startNanos) {
        return ToolCallRecord.builder()
                .toolName(action)
                .input(input)
                .output(output)
                .success(success)
                .duration((System.nanoTime() - startNanos) / 1_000_000)
                .build();
    }
}
