package com.deepansh.react.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentEventType {
    START("start"),
    STEP_COMPLETE("step_complete"),
    TOOL_CALL("tool_call"),
    FINAL_RESULT("final_result"),
    DONE("done"),
    ERROR("error");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
