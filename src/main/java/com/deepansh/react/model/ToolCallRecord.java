package com.deepansh.react.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of dispatching one non-terminating step to a tool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRecord {

    private String toolName;
    private String input;
    private String output;
    private boolean success;

    /** Elapsed millis */
    private long duration;
}
