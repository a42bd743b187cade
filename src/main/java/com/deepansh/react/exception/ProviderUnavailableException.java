package com.deepansh.react.exception;

/**
 * Transient provider failure (5xx or 429). Retried, and counted by the
 * circuit breaker. Surfaces as 502 once retries are exhausted.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final int statusCode;

    public ProviderUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
