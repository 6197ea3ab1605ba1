package com.taskrelay.orchestrator.api.dto;

import com.taskrelay.orchestrator.model.TaskLogEntry;
import com.taskrelay.orchestrator.model.TaskState;

import java.time.Instant;

/** One audit-trail line, returned by GET /tasks/{id}/logs. */
public record TaskLogResponse(
        Instant            createdAt,
        TaskLogEntry.Level level,
        TaskState          state,
        String             message
) {
    public static TaskLogResponse from(TaskLogEntry e) {
        return new TaskLogResponse(e.getCreatedAt(), e.getLevel(), e.getState(), e.getMessage());
    }
}
