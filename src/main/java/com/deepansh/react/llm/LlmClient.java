package com.deepansh.react.llm;

/**
 * Text-generation oracle used by the agent loop.
 */
public interface LlmClient {

    /**
     * Send a system prompt and a single user prompt, return the model's text.
     *
     * @param systemPrompt instructions and tool catalog
     * @param userPrompt   question plus transcript of prior steps
     * @param options      per-call sampling overrides
     * @return the assistant message content, never null
     * @throws RuntimeException on any provider or network failure; there is no fallback answer
     */
    String generate(String systemPrompt, String userPrompt, LlmOptions options);

    /** Model name used when a call does not override it */
    String defaultModel();
}
