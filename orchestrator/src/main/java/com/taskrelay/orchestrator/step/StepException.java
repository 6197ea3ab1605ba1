package com.taskrelay.orchestrator.step;

import com.taskrelay.orchestrator.model.FailureReason;

/**
 * Thrown when a step handler fails in a way that should fail the task.
 *
 * Unchecked: the orchestrator is the only place that catches it and turns it
 * into a FAILED task; nothing retries.
 */
public class StepException extends RuntimeException {

    public enum Kind { HANDLER_FAILURE, PUBLISH_ERROR }

    private final Kind kind;

    public StepException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public StepException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public FailureReason failureReason() {
        return switch (kind) {
            case HANDLER_FAILURE -> FailureReason.HANDLER_FAILURE;
            case PUBLISH_ERROR   -> FailureReason.PUBLISH_ERROR;
        };
    }
}
