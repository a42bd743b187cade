package com.deepansh.react.resilience;

import com.deepansh.react.llm.LlmClient;
import com.deepansh.react.llm.LlmOptions;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker.
 *
 * No fallback method: once retries are exhausted or the circuit is open the
 * exception reaches the agent loop, which ends the run with an error event.
 *
 * Retry config (in application.yml):
 * - 3 attempts, exponential backoff from 1s
 * - Retries on network errors and 5xx; AgentException is not retried
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient")
    @CircuitBreaker(name = "llmClient")
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        return delegate.generate(systemPrompt, userPrompt, options);
    }

    @Override
    public String defaultModel() {
        return delegate.defaultModel();
    }
}
