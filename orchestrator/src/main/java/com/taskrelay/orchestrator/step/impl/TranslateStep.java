package com.taskrelay.orchestrator.step.impl;

import com.taskrelay.orchestrator.capability.CapabilityException;
import com.taskrelay.orchestrator.capability.CapabilityProvider;
import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.step.*;
import org.springframework.stereotype.Component;

/**
 * Translates the step input from the task's source language to its target
 * language. Output is the translated text; no artifacts.
 */
@Component
public class TranslateStep implements StepHandler {

    private static final StepManifest MANIFEST = new StepManifest(
            StepName.TRANSLATE, "1.0.0", ExecutionMode.LOCAL,
            "Translate text between two natural languages.");

    private final CapabilityProvider capabilities;

    public TranslateStep(CapabilityProvider capabilities) {
        this.capabilities = capabilities;
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    public StepResult execute(StepExecutionContext ctx) {
        try {
            return StepResult.of(capabilities.translate(
                    ctx.input(), ctx.sourceLanguage(), ctx.targetLanguage()));
        } catch (CapabilityException e) {
            throw new StepException(StepException.Kind.HANDLER_FAILURE,
                    "translate failed: " + e.getMessage(), e);
        }
    }
}
