package com.taskrelay.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a Task.
 *
 * Transitions:
 *   PENDING           → RUNNING | FAILED
 *   RUNNING           → RUNNING | AWAITING_DELEGATE | COMPLETED | FAILED
 *   AWAITING_DELEGATE → RUNNING | COMPLETED | FAILED
 *
 * COMPLETED and FAILED are terminal. AWAITING_DELEGATE → COMPLETED happens
 * when the delegated step was the last one in the plan.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    AWAITING_DELEGATE,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case PENDING           -> EnumSet.of(RUNNING, FAILED);
            case RUNNING           -> EnumSet.of(RUNNING, AWAITING_DELEGATE, COMPLETED, FAILED);
            case AWAITING_DELEGATE -> EnumSet.of(RUNNING, COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
