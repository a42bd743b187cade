package com.deepansh.react.model;

import com.deepansh.react.core.TaskType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactRequest {

    @NotBlank(message = "question must not be blank")
    private String question;

    @NotNull(message = "taskType is required")
    private TaskType taskType;

    /** Upper bound is agent.max-steps-limit, checked by the controller */
    @Min(value = 1, message = "maxSteps must be at least 1")
    @Builder.Default
    private int maxSteps = 5;

    /**
     * Tool names offered to the model. Empty means the task type's preferred tools.
     * The finish action is always offered.
     */
    @Builder.Default
    private List<String> availableTools = new ArrayList<>();

    /** Optional, overrides agent.step.temperature */
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;

    /** Optional, overrides the provider's configured model */
    private String modelName;

    @Builder.Default
    private boolean stream = true;
}
