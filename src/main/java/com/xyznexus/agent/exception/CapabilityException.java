package com.xyznexus.agent.exception;

/**
 * Thrown by a capability when it cannot produce a result. The registry turns it
 * into an error result message so the specialist can react to it.
 */
public class CapabilityException extends NexusException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
