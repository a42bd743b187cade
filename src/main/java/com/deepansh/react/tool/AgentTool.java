package com.deepansh.react.tool;

import java.util.List;

/**
 * Contract every tool must implement.
 *
 * The name, usage and description are rendered into the system prompt so the
 * model knows how to call the tool as an action. The model emits the action name
 * and a single free-text input; the tool gets that input verbatim.
 *
 * Unlike a prompt-level error string, an exception thrown from {@link #invoke}
 * is caught by the dispatcher and recorded as a failed tool call. The run carries on.
 */
public interface AgentTool {

    /** Unique lower-case name the model uses as its action */
    String getName();

    /** Primary signal the model uses to pick this tool */
    String getDescription();

    /** Call syntax shown to the model, e.g. {@code search[query]} */
    String getUsage();

    List<String> getExamples();

    /**
     * Run the tool against the model's action input and return the observation.
     */
    String invoke(String input);
}
