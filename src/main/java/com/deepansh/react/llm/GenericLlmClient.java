package com.deepansh.react.llm;

import com.deepansh.react.exception.AgentException;
import com.deepansh.react.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion client. Works with Groq, OpenAI, and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                                    |
 * |--------------------------|-----------------------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried, not CB failure)              |
 * | 400 model_decommissioned | AgentException with guidance message                      |
 * | 429 rate limit           | ProviderUnavailableException (retried, counts as failure) |
 * | 4xx other                | AgentException (not retried, not CB failure)              |
 * | 5xx server error         | ProviderUnavailableException (retried, counts as failure) |
 * | network error            | ResourceAccessException (retried)                         |
 * | no choices / no content  | AgentException                                            |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        Map<String, Object> requestBody = buildRequestBody(systemPrompt, userPrompt, options);

        log.debug("Sending prompt to {} [model={}, temperature={}]",
                props.getName(), requestBody.get("model"), requestBody.get("temperature"));

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                    throw new ProviderUnavailableException(
                            props.getName() + " server error [" + res.getStatusCode() + "]: " + body,
                            res.getStatusCode().value());
                })
                .body(new ParameterizedTypeReference<Map<String, Object>>() {});

        return extractContent(response);
    }

    @Override
    public String defaultModel() {
        return props.getModel();
    }

    /**
     * Maps 4xx codes to the exception type the retry and circuit breaker expect.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update the model in application.yml or via the provider's *_MODEL env var");
            log.error("================================================================");
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned.");
        }

        if (statusCode == 401) {
            throw new AgentException(
                    props.getName() + " API key is invalid. Check your " +
                    props.getName().toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new ProviderUnavailableException(props.getName() + " rate limit exceeded", statusCode);
        }

        throw new AgentException(props.getName() + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String systemPrompt, String userPrompt, LlmOptions options) {
        String model = options != null && options.getModel() != null && !options.getModel().isBlank()
                ? options.getModel() : props.getModel();
        double temperature = options != null && options.getTemperature() != null
                ? options.getTemperature() : props.getTemperature();
        int maxTokens = options != null && options.getMaxTokens() != null
                ? options.getMaxTokens() : props.getMaxTokens();

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)
        ));
        return body;
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        if (response == null) {
            throw new AgentException(props.getName() + " returned an empty response body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(props.getName() + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage prompt={} completion={}",
                    usage.get("prompt_tokens"), usage.get("completion_tokens"));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message != null ? message.get("content") : null;
        if (content == null) {
            throw new AgentException(props.getName() + " returned a message without content");
        }
        return content.toString();
    }
}
