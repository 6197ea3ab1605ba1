package com.taskrelay.orchestrator.step;

import java.util.UUID;

/**
 * Runtime context passed to every local step invocation.
 *
 * @param taskId         owning task, for logs and metrics
 * @param input          the step input (previous step's output, or the task text)
 * @param sourceLanguage language of the task's original text
 * @param targetLanguage language the caller wants back
 */
public record StepExecutionContext(
        UUID   taskId,
        String input,
        String sourceLanguage,
        String targetLanguage) {}
