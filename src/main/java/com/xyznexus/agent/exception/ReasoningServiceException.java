package com.xyznexus.agent.exception;

/**
 * The reasoning service could not produce a reply: bad credentials, rejected
 * request, unparseable response, or retries exhausted.
 * Inside a specialist loop this forces the loop to finish degraded.
 */
public class ReasoningServiceException extends NexusException {

    public ReasoningServiceException(String message) {
        super(message);
    }

    public ReasoningServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
