package com.deepansh.react.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One thought → action → observation iteration of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactStep {

    /** 1-based, no gaps */
    private int stepNumber;

    private String thought;
    private String action;
    private String actionInput;

    /** Tool output, the completion marker, or an error description */
    private String observation;

    /** Epoch millis when the step completed */
    private long timestamp;
}
