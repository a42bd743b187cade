package com.deepansh.react.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw LLM client for the provider selected by LLM_PROVIDER.
 * ResilientLlmClient wraps it and is the bean the agent loop sees.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url}") private String geminiBaseUrl;
    @Value("${gemini.model}")    private String geminiModel;
    @Value("${gemini.max-tokens}") private int geminiMaxTokens;
    @Value("${gemini.temperature}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeProps().getModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        LlmProviderProperties props = activeProps();
        logKey(props);
        return new GenericLlmClient(props, builder.clone());
    }

    private LlmProviderProperties activeProps() {
        return switch (provider.toLowerCase()) {
            case "groq" -> props("groq", groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp);
            case "gemini" -> props("gemini", geminiKey, geminiBaseUrl, geminiModel, geminiMaxTokens, geminiTemp);
            default -> props("openai", openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp);
        };
    }

    private LlmProviderProperties props(String name, String key, String baseUrl, String model,
                                        int maxTokens, double temperature) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setName(name); p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temperature);
        return p;
    }

    private void logKey(LlmProviderProperties props) {
        String key = props.getApiKey();
        if (!props.hasApiKey()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", props.getName().toUpperCase(),
                    props.getName().toUpperCase());
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
