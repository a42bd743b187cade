package com.deepansh.react.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a completed run, sent as the final_result payload
 * and as the body of the blocking endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactResult {

    private String question;
    private String taskType;

    @Builder.Default
    private List<ReactStep> steps = new ArrayList<>();

    @Builder.Default
    private List<ToolCallRecord> toolCalls = new ArrayList<>();

    private String finalAnswer;
    private int totalSteps;

    /** Elapsed millis for the whole run */
    private long totalTime;

    /** Distinct tool names across toolCalls */
    @Builder.Default
    private List<String> usedTools = new ArrayList<>();

    private String reasoning;
    private String model;

    /** True once finalAnswer is set, by the finish action or by fallback synthesis */
    private boolean finished;

    /** True when the answer came from fallback synthesis */
    private boolean budgetExhausted;
}
