package com.taskrelay.orchestrator.step;

import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepName;

/**
 * Identity and routing metadata for a step handler.
 *
 * @param name        Which planned step this handler executes.
 * @param version     Semantic version; logged at registration.
 * @param mode        LOCAL handlers run in this JVM, DELEGATED ones describe a counterparty.
 * @param description One-line summary shown by the status API and in logs.
 */
public record StepManifest(
        StepName      name,
        String        version,
        ExecutionMode mode,
        String        description) {}
