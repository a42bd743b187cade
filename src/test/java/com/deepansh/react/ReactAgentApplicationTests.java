package com.deepansh.react;

import com.deepansh.react.llm.LlmClient;
import com.deepansh.react.resilience.ResilientLlmClient;
import com.deepansh.react.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ReactAgentApplicationTests {

    @Autowired LlmClient llmClient;
    @Autowired ToolRegistry toolRegistry;

    @Test
    void contextLoads_withResilientClientAndBuiltInTools() {
        assertThat(llmClient).isInstanceOf(ResilientLlmClient.class);
        assertThat(toolRegistry.toolNames())
                .containsExactlyInAnyOrder("search", "calculator", "knowledge", "lookup", "finish");
    }
}
