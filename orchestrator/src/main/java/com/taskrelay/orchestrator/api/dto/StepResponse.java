package com.taskrelay.orchestrator.api.dto;

import com.taskrelay.orchestrator.model.DelegateRef;
import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepRecord;
import com.taskrelay.orchestrator.model.StepStatus;

import java.time.Instant;

/**
 * Read-only view of a step record, returned by GET /tasks/{id}/steps and
 * embedded in {@link TaskResponse}. delegateRef is non-null only while the
 * step waits on its counterparty.
 */
public record StepResponse(
        String        name,
        ExecutionMode mode,
        StepStatus    status,
        int           attempt,
        String        input,
        String        output,
        DelegateRef   delegateRef,
        Instant       startedAt,
        Instant       finishedAt
) {
    public static StepResponse from(StepRecord s) {
        return new StepResponse(
                s.getName().wireName(),
                s.getMode(),
                s.getStatus(),
                s.getAttempt(),
                s.getInput(),
                s.getOutput(),
                s.getDelegateRef().orElse(null),
                s.getStartedAt(),
                s.getFinishedAt()
        );
    }
}
