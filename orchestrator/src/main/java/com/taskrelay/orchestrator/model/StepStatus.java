package com.taskrelay.orchestrator.model;

/**
 * Execution status of a single StepRecord.
 *
 * Transitions:
 *   NOT_STARTED → IN_PROGRESS            (picked up by the orchestrator)
 *   IN_PROGRESS → DONE | FAILED          (local handler returned)
 *   IN_PROGRESS → DELEGATED              (subtask created on a counterparty)
 *   DELEGATED   → DONE | FAILED          (counterparty reported, or timed out)
 */
public enum StepStatus {
    NOT_STARTED,
    IN_PROGRESS,
    DELEGATED,
    DONE,
    FAILED;

    public boolean isFinished() {
        return this == DONE || this == FAILED;
    }
}
