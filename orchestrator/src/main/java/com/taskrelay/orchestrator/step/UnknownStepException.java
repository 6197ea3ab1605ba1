package com.taskrelay.orchestrator.step;

/**
 * A task's declared intent cannot be turned into registered steps.
 */
public class UnknownStepException extends RuntimeException {
    public UnknownStepException(String message) {
        super(message);
    }
}
