package com.deepansh.react.core;

import com.deepansh.react.config.AgentProperties;
import com.deepansh.react.llm.LlmClient;
import com.deepansh.react.llm.LlmOptions;
import com.deepansh.react.model.ReactStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Best-effort answer for a run that used its whole step budget without finishing.
 * One model call at reduced temperature; failures propagate to the caller.
 */
@Component
@Slf4j
public class FallbackSynthesizer {

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final AgentProperties.Fallback settings;

    public FallbackSynthesizer(LlmClient llmClient, PromptBuilder promptBuilder, AgentProperties properties) {
        this.llmClient = llmClient;
        this.promptBuilder = promptBuilder;
        this.settings = properties.getFallback();
    }

    public String synthesize(String question, List<ReactStep> steps, String modelName) {
        log.info("Synthesizing fallback answer from {} step(s)", steps.size());

        LlmOptions options = LlmOptions.builder()
                .model(modelName)
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .build();

        return llmClient.generate(
                PromptBuilder.FALLBACK_SYSTEM_PROMPT,
                promptBuilder.fallbackPrompt(question, steps),
                options);
    }
}
