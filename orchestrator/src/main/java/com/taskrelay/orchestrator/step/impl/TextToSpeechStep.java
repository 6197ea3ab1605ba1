package com.taskrelay.orchestrator.step.impl;

import com.taskrelay.orchestrator.capability.CapabilityException;
import com.taskrelay.orchestrator.capability.CapabilityProvider;
import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.publisher.ArtifactPublisher;
import com.taskrelay.orchestrator.publisher.PublishException;
import com.taskrelay.orchestrator.step.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Synthesizes speech for the step input and publishes the audio.
 *
 * The published locator is recorded as the {@value #AUDIO_ARTIFACT} artifact
 * and also becomes the step output, so a caller reading only outputs still
 * gets the link.
 */
@Component
public class TextToSpeechStep implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(TextToSpeechStep.class);

    public static final String AUDIO_ARTIFACT     = "audio";
    public static final String AUDIO_CONTENT_TYPE = "audio/mpeg";

    private static final StepManifest MANIFEST = new StepManifest(
            StepName.TEXT2SPEECH, "1.0.0", ExecutionMode.LOCAL,
            "Convert text to spoken audio and publish it.");

    private final CapabilityProvider capabilities;
    private final ArtifactPublisher  publisher;

    public TextToSpeechStep(CapabilityProvider capabilities, ArtifactPublisher publisher) {
        this.capabilities = capabilities;
        this.publisher    = publisher;
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    public StepResult execute(StepExecutionContext ctx) {
        byte[] audio;
        try {
            audio = capabilities.synthesizeSpeech(ctx.input());
        } catch (CapabilityException e) {
            throw new StepException(StepException.Kind.HANDLER_FAILURE,
                    "text2speech failed: " + e.getMessage(), e);
        }

        String locator;
        try {
            locator = publisher.publish(audio, AUDIO_CONTENT_TYPE);
        } catch (PublishException e) {
            throw new StepException(StepException.Kind.PUBLISH_ERROR,
                    "Could not publish audio: " + e.getMessage(), e);
        }
        log.info("Task {} audio published at {}", ctx.taskId(), locator);
        return new StepResult(locator, Map.of(AUDIO_ARTIFACT, locator));
    }
}
