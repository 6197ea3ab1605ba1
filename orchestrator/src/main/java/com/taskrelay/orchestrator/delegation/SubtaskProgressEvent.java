package com.taskrelay.orchestrator.delegation;

import java.util.UUID;

/**
 * A counterparty reported a non-terminal status for a delegated step.
 */
public record SubtaskProgressEvent(
        UUID   taskId,
        String remoteId,
        String status,
        String message) {}
