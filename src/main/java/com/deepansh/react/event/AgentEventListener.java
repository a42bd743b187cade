package com.deepansh.react.event;

/**
 * Receives run progress events in the order they happen.
 * Implementations must not block for long; the loop waits on each call.
 */
@FunctionalInterface
public interface AgentEventListener {

    /** Discards every event. */
    AgentEventListener NOOP = event -> { };

    void onEvent(AgentEvent event);
}
