package com.deepansh.react.api;

import com.deepansh.react.config.AgentProperties;
import com.deepansh.react.core.AgentRun;
import com.deepansh.react.core.ReactAgentLoop;
import com.deepansh.react.core.RunCancellation;
import com.deepansh.react.core.TaskType;
import com.deepansh.react.model.ReactRequest;
import com.deepansh.react.model.ReactResult;
import com.deepansh.react.tool.ToolDefinition;
import com.deepansh.react.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ReAct agent endpoints.
 *
 * POST /api/v1/react/run        blocking, returns the full result as JSON
 * POST /api/v1/react/stream     text/event-stream of start, step_complete, tool_call,
 *                                 final_result, done (or a single error)
 * GET  /api/v1/react/tools      tool catalog
 * GET  /api/v1/react/task-types task profiles
 * GET  /api/v1/react/health
 */
@RestController
@RequestMapping("/api/v1/react")
@Slf4j
public class ReactAgentController {

    private final ReactAgentLoop agentLoop;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final TaskExecutor runExecutor;

    public ReactAgentController(ReactAgentLoop agentLoop,
                                ToolRegistry toolRegistry,
                                AgentProperties properties,
                                @Qualifier("agentRunExecutor") TaskExecutor runExecutor) {
        this.agentLoop = agentLoop;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    @PostMapping("/run")
    public ResponseEntity<ReactResult> run(@Valid @RequestBody ReactRequest request) {
        log.info("ReAct run request [taskType={}, maxSteps={}, tools={}]",
                request.getTaskType(), request.getMaxSteps(), request.getAvailableTools());
        return ResponseEntity.ok(agentLoop.run(request));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ReactRequest request) {
        AgentRun run = agentLoop.prepare(request);
        log.info("ReAct stream request [runId={}, taskType={}, maxSteps={}]",
                run.getRunId(), run.getTaskType().getCode(), run.getMaxSteps());

        SseEmitter emitter = new SseEmitter(properties.getStream().getTimeoutMs());
        RunCancellation cancellation = new RunCancellation();

        emitter.onTimeout(() -> {
            log.warn("SSE connection timed out [runId={}]", run.getRunId());
            cancellation.cancel();
            emitter.complete();
        });
        emitter.onError(throwable -> {
            log.warn("SSE connection error [runId={}]: {}", run.getRunId(), throwable.getMessage());
            cancellation.cancel();
        });
        emitter.onCompletion(cancellation::cancel);

        SseEventSink sink = new SseEventSink(emitter, cancellation);
        runExecutor.execute(() -> {
            try {
                agentLoop.execute(run, sink, cancellation);
            } catch (RuntimeException e) {
                // already logged by the loop and delivered as an error event
                log.debug("Streamed run ended with error [runId={}]: {}", run.getRunId(), e.getMessage());
            } finally {
                emitter.complete();
            }
        });

        return emitter;
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> tools() {
        return ResponseEntity.ok(toolRegistry.getAllDefinitions());
    }

    @GetMapping("/task-types")
    public ResponseEntity<List<Map<String, Object>>> taskTypes() {
        return ResponseEntity.ok(Arrays.stream(TaskType.values())
                .map(this::describe)
                .toList());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private Map<String, Object> describe(TaskType type) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", type.getCode());
        entry.put("name", type.getLabel());
        entry.put("description", type.getDescription());
        entry.put("preferredTools", type.getPreferredTools());
        entry.put("maxThoughts", type.getTypicalThoughts());
        return entry;
    }
}
