package com.taskrelay.orchestrator.api.dto;

import com.taskrelay.orchestrator.model.FailureReason;
import com.taskrelay.orchestrator.model.Task;
import com.taskrelay.orchestrator.model.TaskState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /tasks and GET /tasks/{id}.
 *
 * Carries everything a caller needs to tell "still running", "delegated,
 * awaiting result" and "failed: reason" apart.
 */
public record TaskResponse(
        UUID                id,
        TaskState           state,
        List<String>        intent,
        FailureReason       failureReason,
        String              failureMessage,
        List<StepResponse>  steps,
        Map<String, String> artifacts,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getState(),
                task.getDeclaredIntent(),
                task.getFailureReason(),
                task.getFailureMessage(),
                task.getSteps().stream().map(StepResponse::from).toList(),
                task.getArtifacts(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
