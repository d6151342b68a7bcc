package com.xyznexus.agent.exception;

/**
 * Root of the orchestration exception hierarchy.
 */
public class NexusException extends RuntimeException {

    public NexusException(String message) {
        super(message);
    }

    public NexusException(String message, Throwable cause) {
        super(message, cause);
    }
}
