package com.deepansh.react.llm;

import lombok.Builder;
import lombok.Data;

/**
 * Per-call sampling settings. Null fields fall back to the provider's configuration.
 */
@Data
@Builder
public class LlmOptions {

    /** Overrides the provider's configured model when set */
    private String model;

    private Double temperature;

    private Integer maxTokens;
}
