package com.deepansh.react.core;

import com.deepansh.react.model.ReactStep;
import com.deepansh.react.model.ToolCallRecord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Holds all mutable state for a single agent run.
 * Created fresh per request and only touched by the thread executing the loop.
 */
@Getter
public class AgentRun {

    private final String runId;
    private final String question;
    private final TaskType taskType;
    private final int maxSteps;
    private final Set<String> availableTools;

    /** Null means the provider's configured model / temperature */
    private final String modelName;
    private final Double temperature;

    private final long startTimeMs = System.currentTimeMillis();

    private final List<ReactStep> steps = new ArrayList<>();
    private final List<ToolCallRecord> toolCalls = new ArrayList<>();

    private String finalAnswer;
    private RunState state = RunState.RUNNING;

    public AgentRun(String runId, String question, TaskType taskType, int maxSteps,
                    Set<String> availableTools, String modelName, Double temperature) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        this.runId = runId;
        this.question = question;
        this.taskType = taskType;
        this.maxSteps = maxSteps;
        this.availableTools = Collections.unmodifiableSet(new LinkedHashSet<>(availableTools));
        this.modelName = modelName;
        this.temperature = temperature;
    }

    public List<ReactStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public List<ToolCallRecord> getToolCalls() {
        return Collections.unmodifiableList(toolCalls);
    }

    public boolean isFinished() {
        return finalAnswer != null;
    }

    public int nextStepNumber() {
        return steps.size() + 1;
    }

    public boolean hasStepBudget() {
        return steps.size() < maxSteps;
    }

    /** Distinct tool names across tool calls, in first-use order. */
    public List<String> usedTools() {
        return toolCalls.stream()
                .map(ToolCallRecord::getToolName)
                .distinct()
                .toList();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    void appendStep(ReactStep step) {
        requireState(RunState.RUNNING);
        if (!hasStepBudget()) {
            throw new IllegalStateException("Step budget of " + maxSteps + " already used");
        }
        if (step.getStepNumber() != nextStepNumber()) {
            throw new IllegalStateException("Expected step " + nextStepNumber() + " but got " + step.getStepNumber());
        }
        steps.add(step);
    }

    void appendToolCall(ToolCallRecord toolCall) {
        requireState(RunState.RUNNING);
        if (toolCalls.size() >= steps.size()) {
            throw new IllegalStateException("Tool call without a matching step");
        }
        toolCalls.add(toolCall);
    }

    void finish(String answer) {
        requireState(RunState.RUNNING);
        setFinalAnswer(answer);
        state = RunState.FINISHED;
    }

    void exhaust() {
        requireState(RunState.RUNNING);
        state = RunState.EXHAUSTED;
    }

    void completeWithFallback(String answer) {
        requireState(RunState.EXHAUSTED);
        setFinalAnswer(answer);
    }

    private void setFinalAnswer(String answer) {
        if (finalAnswer != null) {
            throw new IllegalStateException("Final answer already set for run " + runId);
        }
        finalAnswer = answer == null ? "" : answer;
    }

    private void requireState(RunState expected) {
        if (state != expected) {
            throw new IllegalStateException("Run " + runId + " is " + state + ", expected " + expected);
        }
    }
}
