package com.taskrelay.orchestrator.api.dto;

/** Optional body for POST /tasks/{id}/cancel. */
public record CancelTaskRequest(String reason) {

    public String reasonOrDefault() {
        return reason == null || reason.isBlank() ? "Cancelled by caller" : reason;
    }
}
