package com.taskrelay.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of running one step, locally or on a counterparty.
 *
 * A successful outcome carries the step output and any artifacts it published
 * (name → locator). A failed outcome carries the reason the owning task will
 * be failed with.
 */
public record StepOutcome(
        boolean             success,
        String              output,
        Map<String, String> artifacts,
        FailureReason       failureReason,
        String              message) {

    public StepOutcome {
        artifacts = artifacts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public static StepOutcome success(String output) {
        return new StepOutcome(true, output, Map.of(), null, null);
    }

    public static StepOutcome success(String output, Map<String, String> artifacts) {
        return new StepOutcome(true, output, artifacts, null, null);
    }

    public static StepOutcome failure(FailureReason reason, String message) {
        return new StepOutcome(false, null, Map.of(), reason, message);
    }

    public static StepOutcome timedOut(String message) {
        return failure(FailureReason.TIMED_OUT, message);
    }
}
