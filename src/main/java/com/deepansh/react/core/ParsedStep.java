package com.deepansh.react.core;

import com.deepansh.react.tool.ToolRegistry;

import java.util.Set;

/**
 * Thought, action and action input extracted from one model response.
 *
 * {@code outcome} tells a clean parse apart from one where at least one field
 * fell back to its configured default; the loop treats both the same way.
 */
public record ParsedStep(
        String thought,
        String action,
        String actionInput,
        Outcome outcome,
        Set<Field> defaultedFields
) {

    public enum Outcome { PARSED, DEFAULTED }

    public enum Field { THOUGHT, ACTION, ACTION_INPUT }

    public ParsedStep {
        defaultedFields = Set.copyOf(defaultedFields);
    }

    public boolean isFinish() {
        return ToolRegistry.FINISH.equals(action);
    }

    public boolean isDefaulted() {
        return outcome == Outcome.DEFAULTED;
    }
}
