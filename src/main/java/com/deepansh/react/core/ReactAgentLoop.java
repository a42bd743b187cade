package com.deepansh.react.core;

import com.deepansh.react.config.AgentProperties;
import com.deepansh.react.event.AgentEventListener;
import com.deepansh.react.event.ProgressReporter;
import com.deepansh.react.exception.AgentCancelledException;
import com.deepansh.react.llm.LlmClient;
import com.deepansh.react.llm.LlmOptions;
import com.deepansh.react.model.ReactRequest;
import com.deepansh.react.model.ReactResult;
import com.deepansh.react.model.ReactStep;
import com.deepansh.react.model.ToolCallRecord;
import com.deepansh.react.tool.ToolDefinition;
import com.deepansh.react.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Core ReAct (Reason → Act → Observe) agent loop.
 *
 * Per-run flow:
 * 1. Resolve the offered tools and build the system prompt once
 * 2. Each step: model → parse → finish, or dispatch tool and record the observation
 * 3. Stop on the finish action or when maxSteps steps exist
 * 4. Budget used up without finish → one fallback synthesis call
 *
 * Step k's prompt contains steps 1..k-1 verbatim. Model failures are not caught
 * here: they end the run with a single error event and propagate to the caller.
 */
@Service
@Slf4j
public class ReactAgentLoop {

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final StepParser stepParser;
    private final PromptBuilder promptBuilder;
    private final ActionDispatcher actionDispatcher;
    private final FallbackSynthesizer fallbackSynthesizer;
    private final AgentProperties properties;

    public ReactAgentLoop(LlmClient llmClient,
                          ToolRegistry toolRegistry,
                          StepParser stepParser,
                          PromptBuilder promptBuilder,
                          ActionDispatcher actionDispatcher,
                          FallbackSynthesizer fallbackSynthesizer,
                          AgentProperties properties) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.stepParser = stepParser;
        this.promptBuilder = promptBuilder;
        this.actionDispatcher = actionDispatcher;
        this.fallbackSynthesizer = fallbackSynthesizer;
        this.properties = properties;
    }

    /**
     * Validates a request and creates the run state for it.
     *
     * @throws IllegalArgumentException for an out-of-range maxSteps or an unknown tool name
     */
    public AgentRun prepare(ReactRequest request) {
        if (request.getMaxSteps() < 1 || request.getMaxSteps() > properties.getMaxStepsLimit()) {
            throw new IllegalArgumentException(
                    "maxSteps must be between 1 and " + properties.getMaxStepsLimit() + ", got " + request.getMaxSteps());
        }

        List<String> requested = request.getAvailableTools() == null || request.getAvailableTools().isEmpty()
                ? request.getTaskType().getPreferredTools()
                : request.getAvailableTools();

        Set<String> offered = new LinkedHashSet<>();
        for (String name : requested) {
            String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            if (!toolRegistry.hasTool(normalized)) {
                throw new IllegalArgumentException(
                        "Unknown tool '" + name + "'. Known tools: " + toolRegistry.toolNames());
            }
            offered.add(normalized);
        }
        offered.add(ToolRegistry.FINISH);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        return new AgentRun(runId, request.getQuestion(), request.getTaskType(), request.getMaxSteps(),
                offered, request.getModelName(), request.getTemperature());
    }

    /** Blocking run with progress events discarded. */
    public ReactResult run(ReactRequest request) {
        return execute(prepare(request), AgentEventListener.NOOP, RunCancellation.none());
    }

    public ReactResult execute(AgentRun run, AgentEventListener listener, RunCancellation cancellation) {
        log.info("ReAct run started [runId={}, taskType={}, maxSteps={}, tools={}, question='{}']",
                run.getRunId(), run.getTaskType().getCode(), run.getMaxSteps(),
                run.getAvailableTools(), run.getQuestion());

        ProgressReporter reporter = new ProgressReporter(run.getRunId(), listener);
        reporter.runStarted(run);

        try {
            ReactResult result = executeLoop(run, reporter, cancellation);
            reporter.runSucceeded(result);

            log.info("ReAct run complete [runId={}, state={}, steps={}, toolCalls={}, latency={}ms]",
                    run.getRunId(), run.getState(), run.getSteps().size(),
                    run.getToolCalls().size(), result.getTotalTime());
            return result;

        } catch (AgentCancelledException e) {
            log.info("ReAct run cancelled [runId={}, steps={}]", run.getRunId(), run.getSteps().size());
            reporter.runFailed(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("ReAct run failed [runId={}, steps={}]", run.getRunId(), run.getSteps().size(), e);
            reporter.runFailed(e);
            throw e;
        }
    }

    private ReactResult executeLoop(AgentRun run, ProgressReporter reporter, RunCancellation cancellation) {
        List<ToolDefinition> tools = toolRegistry.getDefinitions(run.getAvailableTools());
        String systemPrompt = promptBuilder.systemPrompt(run.getTaskType(), tools);
        LlmOptions stepOptions = LlmOptions.builder()
                .model(run.getModelName())
                .temperature(run.getTemperature() != null
                        ? run.getTemperature() : properties.getStep().getTemperature())
                .maxTokens(properties.getStep().getMaxTokens())
                .build();

        while (run.getState() == RunState.RUNNING && run.hasStepBudget()) {
            checkCancelled(run, cancellation);

            int stepNumber = run.nextStepNumber();
            log.info("ReAct step {}/{} [runId={}]", stepNumber, run.getMaxSteps(), run.getRunId());

            String output = llmClient.generate(
                    systemPrompt,
                    promptBuilder.transcriptPrompt(run.getQuestion(), run.getSteps()),
                    stepOptions);
            ParsedStep parsed = stepParser.parse(output);

            if (parsed.isFinish()) {
                ReactStep step = step(stepNumber, parsed, properties.getCompletionMarker());
                run.appendStep(step);
                run.finish(parsed.actionInput());
                reporter.stepCompleted(step);
                log.info("Finish action at step {} [runId={}]", stepNumber, run.getRunId());
                break;
            }

            ToolCallRecord toolCall = actionDispatcher.dispatch(
                    parsed.action(), parsed.actionInput(), run.getAvailableTools());
            ReactStep step = step(stepNumber, parsed, toolCall.getOutput());
            run.appendStep(step);
            run.appendToolCall(toolCall);
            reporter.stepCompleted(step);
            reporter.toolCalled(toolCall);
        }

        if (run.getState() == RunState.RUNNING) {
            log.warn("ReAct run hit max steps ({}) without finish [runId={}]", run.getMaxSteps(), run.getRunId());
            run.exhaust();
            checkCancelled(run, cancellation);
            run.completeWithFallback(
                    fallbackSynthesizer.synthesize(run.getQuestion(), run.getSteps(), run.getModelName()));
        }

        return toResult(run);
    }

    private void checkCancelled(AgentRun run, RunCancellation cancellation) {
        if (cancellation.isCancelled()) {
            throw new AgentCancelledException(run.getSteps().size());
        }
    }

    private ReactStep step(int stepNumber, ParsedStep parsed, String observation) {
        return ReactStep.builder()
                .stepNumber(stepNumber)
                .thought(parsed.thought())
                .action(parsed.action())
                .actionInput(parsed.actionInput())
                .observation(observation)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private ReactResult toResult(AgentRun run) {
        return ReactResult.builder()
                .question(run.getQuestion())
                .taskType(run.getTaskType().getCode())
                .steps(List.copyOf(run.getSteps()))
                .toolCalls(List.copyOf(run.getToolCalls()))
                .finalAnswer(run.getFinalAnswer())
                .totalSteps(run.getSteps().size())
                .totalTime(run.elapsedMs())
                .usedTools(run.usedTools())
                .reasoning(promptBuilder.reasoningSummary(run.getSteps()))
                .model(run.getModelName() != null ? run.getModelName() : llmClient.defaultModel())
                .finished(run.isFinished())
                .budgetExhausted(run.getState() == RunState.EXHAUSTED)
                .build();
    }
}
