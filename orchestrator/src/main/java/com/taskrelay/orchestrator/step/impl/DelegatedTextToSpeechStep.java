package com.taskrelay.orchestrator.step.impl;

import com.taskrelay.orchestrator.delegation.Counterparty;
import com.taskrelay.orchestrator.delegation.DelegationProperties;
import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.step.DelegatedStepHandler;
import com.taskrelay.orchestrator.step.StepManifest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Descriptor for text2speech run by a counterparty agent.
 * Only registered when {@code taskrelay.delegation.text2speech.base-url} is set.
 */
@Component
@ConditionalOnProperty(prefix = "taskrelay.delegation.text2speech", name = "base-url")
public class DelegatedTextToSpeechStep implements DelegatedStepHandler {

    private static final StepManifest MANIFEST = new StepManifest(
            StepName.TEXT2SPEECH, "1.0.0", ExecutionMode.DELEGATED,
            "Convert text to spoken audio on a counterparty agent.");

    private final Counterparty counterparty;

    public DelegatedTextToSpeechStep(DelegationProperties properties) {
        this.counterparty = properties.text2speech().toCounterparty();
    }

    @Override public StepManifest manifest()     { return MANIFEST; }
    @Override public Counterparty counterparty() { return counterparty; }
}
