package com.deepansh.react.exception;

/**
 * Non-retryable failure talking to the model provider: bad credentials,
 * a rejected request or a response with no usable content.
 *
 * Listed in the circuit breaker's ignore list so configuration mistakes
 * do not open the circuit.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
