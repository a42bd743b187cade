package com.deepansh.react.core;

import com.deepansh.react.model.ToolCallRecord;
import com.deepansh.react.tool.AgentTool;
import com.deepansh.react.tool.ToolRegistry;
import com.deepansh.react.tool.impl.CalculatorTool;
import com.deepansh.react.tool.impl.FinishTool;
import com.deepansh.react.tool.impl.SearchTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class ActionDispatcherTest {

    private AgentTool brokenTool;
    private ActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        brokenTool = mock(AgentTool.class);
        when(brokenTool.getName()).thenReturn("broken");
        ToolRegistry registry = new ToolRegistry(List.of(
                new SearchTool(), new CalculatorTool(), new FinishTool(), brokenTool));
        dispatcher = new ActionDispatcher(registry);
    }

    @Test
    void dispatch_knownTool_returnsSuccessfulRecord() {
        ToolCallRecord call = dispatcher.dispatch("calculator", "6 * 7");

        assertThat(call.isSuccess()).isTrue();
        assertThat(call.getToolName()).isEqualTo("calculator");
        assertThat(call.getInput()).isEqualTo("6 * 7");
        assertThat(call.getOutput()).isEqualTo("Result: 42");
        assertThat(call.getDuration()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void dispatch_throwingTool_returnsFailedRecordWithMessage() {
        when(brokenTool.invoke("x")).thenThrow(new IllegalStateException("backend down"));

        ToolCallRecord call = dispatcher.dispatch("broken", "x");

        assertThat(call.isSuccess()).isFalse();
        assertThat(call.getOutput()).isEqualTo("Tool execution failed: backend down");
    }

    @Test
    void dispatch_unknownAction_returnsFailedRecord() {
        ToolCallRecord call = dispatcher.dispatch("teleport", "mars");

        assertThat(call.isSuccess()).isFalse();
        assertThat(call.getToolName()).isEqualTo("teleport");
        assertThat(call.getOutput()).startsWith("Unknown action: teleport");
    }

    @Test
    void dispatch_unknownActionWithPlaceholders_isLoggedVerbatim(CapturedOutput output) {
        ToolCallRecord call = dispatcher.dispatch("look{}up%s", "x", Set.of("search"));

        assertThat(call.getOutput()).isEqualTo("Unknown action: look{}up%s. Available tools: [search]");
        assertThat(output.getOut()).contains("Unknown action [look{}up%s] requested, offered tools: [search]");
    }

    @Test
    void dispatch_registeredButNotOffered_isUnknown() {
        ToolCallRecord call = dispatcher.dispatch("search", "q", Set.of("calculator", "finish"));

        assertThat(call.isSuccess()).isFalse();
        assertThat(call.getOutput()).startsWith("Unknown action: search");
    }

    @Test
    void dispatch_finish_isNeverInvoked() {
        ToolCallRecord call = dispatcher.dispatch("finish", "answer");

        assertThat(call.isSuccess()).isFalse();
        assertThat(call.getOutput()).startsWith("Unknown action: finish");
    }
}
