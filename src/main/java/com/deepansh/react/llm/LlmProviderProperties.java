package com.deepansh.react.llm;

import lombok.Data;

/**
 * Connection and default sampling settings for one OpenAI-compatible provider.
 * Populated from application.yml for openai / groq / gemini.
 */
@Data
public class LlmProviderProperties {
    private String name;
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
