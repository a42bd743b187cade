package com.deepansh.react.event;

import com.deepansh.react.core.AgentRun;
import com.deepansh.react.exception.AgentCancelledException;
import com.deepansh.react.model.ReactResult;
import com.deepansh.react.model.ReactStep;
import com.deepansh.react.model.ToolCallRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns loop transitions of one run into an ordered event sequence.
 *
 * Every event is appended to an in-memory log and forwarded to the listener.
 * A listener failure is logged and otherwise ignored so delivery problems never
 * change what the loop does. Exactly one terminal sequence is emitted per run:
 * final_result + done, or error. Anything after it is dropped.
 */
@Slf4j
public class ProgressReporter {

    private final String runId;
    private final AgentEventListener listener;
    private final List<AgentEvent> events = new ArrayList<>();
    private boolean terminated;

    public ProgressReporter(String runId, AgentEventListener listener) {
        this.runId = runId;
        this.listener = listener != null ? listener : AgentEventListener.NOOP;
    }

    public void runStarted(AgentRun run) {
        emit(AgentEvent.start(run.getQuestion(), run.getTaskType().getCode(), run.getMaxSteps()));
    }

    public void stepCompleted(ReactStep step) {
        emit(AgentEvent.stepComplete(step));
    }

    public void toolCalled(ToolCallRecord toolCall) {
        emit(AgentEvent.toolCall(toolCall));
    }

    public void runSucceeded(ReactResult result) {
        emit(AgentEvent.finalResult(result));
        emit(AgentEvent.done());
    }

    public void runFailed(Throwable error) {
        String message = error instanceof AgentCancelledException
                ? "Run cancelled"
                : "ReAct processing failed";
        String details = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        emit(AgentEvent.error(message, details));
    }

    public boolean isTerminated() {
        return terminated;
    }

    public List<AgentEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    private void emit(AgentEvent event) {
        if (terminated) {
            log.warn("Dropping [{}] event after terminal event [runId={}]", event.getType().wireName(), runId);
            return;
        }
        terminated = event.getType().isTerminal();
        events.add(event);

        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event listener failed on [{}] [runId={}]: {}", event.getType().wireName(), runId, e.getMessage());
        }
    }
}
