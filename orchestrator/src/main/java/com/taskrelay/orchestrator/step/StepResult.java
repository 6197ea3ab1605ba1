package com.taskrelay.orchestrator.step;

import java.util.Map;

/**
 * What a local handler hands back on success.
 *
 * @param output    payload passed on as the next step's input
 * @param artifacts published artifacts, name → locator
 */
public record StepResult(String output, Map<String, String> artifacts) {

    public StepResult {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
    }

    public static StepResult of(String output) {
        return new StepResult(output, Map.of());
    }
}
