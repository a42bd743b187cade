package com.deepansh.react.llm;

import com.deepansh.react.exception.AgentException;
import com.deepansh.react.exception.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private GenericLlmClient client;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setName("groq");
        props.setApiKey("test-key");
        props.setBaseUrl("https://llm.test/v1");
        props.setModel("llama-3.3-70b-versatile");
        props.setMaxTokens(800);
        props.setTemperature(0.7);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, builder);
    }

    @Test
    void generate_returnsFirstChoiceContent() {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Thought: done\\nAction: finish\\nAction Input: 29"}}]}
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.generate("system", "user", null)).endsWith("Action Input: 29");
        server.verify();
    }

    @Test
    void generate_serverError_throwsRetryableProviderFailure() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("overloaded"));

        assertThatThrownBy(() -> client.generate("system", "user", null))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("groq server error")
                .extracting("statusCode").isEqualTo(503);
    }

    @Test
    void generate_rateLimited_throwsRetryableProviderFailure() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> client.generate("system", "user", null))
                .isInstanceOf(ProviderUnavailableException.class)
                .extracting("statusCode").isEqualTo(429);
    }

    @Test
    void generate_invalidKey_throwsAgentException() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid_api_key\"}"));

        assertThatThrownBy(() -> client.generate("system", "user", null))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("GROQ_API_KEY");
    }

    @Test
    void generate_noChoices_throwsAgentException() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generate("system", "user", null))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("no choices");
    }
}
