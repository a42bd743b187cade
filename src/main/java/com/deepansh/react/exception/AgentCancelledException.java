package com.deepansh.react.exception;

/**
 * Thrown by the loop when a cancellation request is seen between steps.
 */
public class AgentCancelledException extends RuntimeException {

    public AgentCancelledException(int completedSteps) {
        super("Run cancelled after " + completedSteps + " step(s)");
    }
}
