package com.taskrelay.orchestrator.api.dto;

import com.taskrelay.orchestrator.model.TaskInput;

import java.util.List;

/**
 * Request body for POST /tasks.
 *
 * Required: text
 * Optional: sourceLanguage, targetLanguage (default Spanish → English),
 *   intent, e.g. ["translate", "text2speech-delegated"]. A missing intent is
 *   an empty plan and completes immediately.
 */
public record SubmitTaskRequest(String text, String sourceLanguage, String targetLanguage,
                                List<String> intent) {

    public SubmitTaskRequest {
        if (intent == null) intent = List.of();
    }

    public TaskInput toInput() {
        return new TaskInput(text, sourceLanguage, targetLanguage);
    }
}
