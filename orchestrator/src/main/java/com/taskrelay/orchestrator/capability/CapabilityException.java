package com.taskrelay.orchestrator.capability;

/**
 * Thrown when the capability provider returns an error or is unreachable.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
