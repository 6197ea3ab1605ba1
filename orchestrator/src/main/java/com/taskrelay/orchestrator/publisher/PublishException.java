package com.taskrelay.orchestrator.publisher;

/**
 * Thrown when an artifact could not be stored.
 */
public class PublishException extends RuntimeException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
