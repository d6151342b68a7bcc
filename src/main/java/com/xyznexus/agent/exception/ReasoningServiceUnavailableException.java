package com.xyznexus.agent.exception;

/**
 * Transient reasoning service failure (network error, timeout, 5xx, rate limit).
 * The only failure type that is retried and counted by the circuit breaker.
 */
public class ReasoningServiceUnavailableException extends ReasoningServiceException {

    public ReasoningServiceUnavailableException(String message) {
        super(message);
    }

    public ReasoningServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
