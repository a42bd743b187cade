package com.deepansh.react.event;

import com.deepansh.react.model.ReactResult;
import com.deepansh.react.model.ReactStep;
import com.deepansh.react.model.ToolCallRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One progress event of a run. Only the fields relevant to {@link #type} are set;
 * nulls are left out of the JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentEvent {

    private AgentEventType type;

    // start
    private String message;
    private String question;
    private String taskType;
    private Integer maxSteps;

    private ReactStep step;
    private ToolCallRecord toolCall;
    private ReactResult result;

    // error
    private String error;
    private String details;

    public static AgentEvent start(String question, String taskType, int maxSteps) {
        return AgentEvent.builder()
                .type(AgentEventType.START)
                .message("Starting ReAct reasoning...")
                .question(question)
                .taskType(taskType)
                .maxSteps(maxSteps)
                .build();
    }

    public static AgentEvent stepComplete(ReactStep step) {
        return AgentEvent.builder().type(AgentEventType.STEP_COMPLETE).step(step).build();
    }

    public static AgentEvent toolCall(ToolCallRecord toolCall) {
        return AgentEvent.builder().type(AgentEventType.TOOL_CALL).toolCall(toolCall).build();
    }

    public static AgentEvent finalResult(ReactResult result) {
        return AgentEvent.builder().type(AgentEventType.FINAL_RESULT).result(result).build();
    }

    public static AgentEvent done() {
        return AgentEvent.builder().type(AgentEventType.DONE).build();
    }

    public static AgentEvent error(String error, String details) {
        return AgentEvent.builder().type(AgentEventType.ERROR).error(error).details(details).build();
    }
}
