package com.taskrelay.orchestrator.delegation;

import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.model.StepOutcome;

import java.util.UUID;

/**
 * A delegated step has a final outcome: the counterparty reported, or the
 * deadline passed. Published exactly once per correlation entry.
 */
public record SubtaskResolvedEvent(
        UUID        taskId,
        StepName    stepName,
        String      remoteId,
        StepOutcome outcome) {}
