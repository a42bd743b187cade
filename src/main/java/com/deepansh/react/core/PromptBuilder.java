package com.deepansh.react.core;

import com.deepansh.react.model.ReactStep;
import com.deepansh.react.tool.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the prompts sent to the model. Pure string formatting, no state.
 */
@Component
public class PromptBuilder {

    static final String FALLBACK_SYSTEM_PROMPT =
            "You are a helpful assistant. Write the final answer based on the ReAct reasoning steps you are given.";

    private static final int SUMMARY_THOUGHT_CHARS = 100;

    public String systemPrompt(TaskType taskType, List<ToolDefinition> tools) {
        String toolLines = tools.stream()
                .map(ToolDefinition::toPromptLine)
                .collect(Collectors.joining("\n"));

        return """
                You are a ReAct agent. You solve problems by interleaving reasoning and actions.

                Task type: %s
                Task description: %s
                Typical number of thoughts: %d

                Available tools:
                %s

                You must reply in exactly this format:

                Thought: [analyse the current situation and plan the next step]
                Action: [one tool name]
                Action Input: [the input for the tool]

                Rules:
                1. Perform exactly one action per reply
                2. Reason clearly about the problem before acting
                3. The action must be one of the available tools
                4. When you have enough information to answer, use the finish action with the answer as its input
                5. Keep the reasoning logical and concise

                Reply strictly in the format above and add nothing else.""".formatted(
                taskType.getLabel(),
                taskType.getDescription(),
                taskType.getTypicalThoughts(),
                toolLines);
    }

    /**
     * Question followed by every prior step verbatim, in order.
     */
    public String transcriptPrompt(String question, List<ReactStep> previousSteps) {
        StringBuilder prompt = new StringBuilder("Question: ").append(question).append("\n\n");

        if (!previousSteps.isEmpty()) {
            prompt.append("Previous steps:\n");
            for (ReactStep step : previousSteps) {
                int n = step.getStepNumber();
                prompt.append("Thought ").append(n).append(": ").append(step.getThought()).append('\n');
                prompt.append("Action ").append(n).append(": ").append(step.getAction()).append('\n');
                prompt.append("Action Input ").append(n).append(": ").append(step.getActionInput()).append('\n');
                prompt.append("Observation ").append(n).append(": ").append(step.getObservation()).append("\n\n");
            }
        }

        prompt.append("Now continue with the next step (step ").append(previousSteps.size() + 1).append("):");
        return prompt.toString();
    }

    public String fallbackPrompt(String question, List<ReactStep> steps) {
        String stepsText = steps.stream()
                .map(step -> "Step " + step.getStepNumber() + ": " + step.getThought()
                        + "\nAction: " + step.getAction() + "(" + step.getActionInput() + ")"
                        + "\nObservation: " + step.getObservation())
                .collect(Collectors.joining("\n\n"));

        return """
                Original question: %s

                ReAct reasoning:
                %s

                Based on the reasoning above, give a clear and accurate final answer:""".formatted(question, stepsText);
    }

    /** One-line "reasoning path" built from the first characters of each thought. */
    public String reasoningSummary(List<ReactStep> steps) {
        if (steps.isEmpty()) return "No reasoning performed";

        String path = steps.stream()
                .map(step -> step.getStepNumber() + ". " + abbreviate(step.getThought()))
                .collect(Collectors.joining(" → "));
        return "Reasoning path: " + path;
    }

    private static String abbreviate(String thought) {
        if (thought == null) return "";
        return thought.length() > SUMMARY_THOUGHT_CHARS
                ? thought.substring(0, SUMMARY_THOUGHT_CHARS) + "..."
                : thought;
    }
}
