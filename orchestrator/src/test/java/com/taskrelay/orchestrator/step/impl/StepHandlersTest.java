package com.taskrelay.orchestrator.step.impl;

import com.taskrelay.orchestrator.capability.CapabilityException;
import com.taskrelay.orchestrator.capability.CapabilityProvider;
import com.taskrelay.orchestrator.delegation.Counterparty;
import com.taskrelay.orchestrator.delegation.DelegationProperties;
import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.publisher.ArtifactPublisher;
import com.taskrelay.orchestrator.publisher.PublishException;
import com.taskrelay.orchestrator.step.StepException;
import com.taskrelay.orchestrator.step.StepExecutionContext;
import com.taskrelay.orchestrator.step.StepResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StepHandlersTest {

    @Mock CapabilityProvider capabilities;
    @Mock ArtifactPublisher  publisher;

    final StepExecutionContext ctx =
            new StepExecutionContext(UUID.randomUUID(), "Hola mundo", "Spanish", "English");

    // ------------------------------------------------------------------
    // TranslateStep
    // ------------------------------------------------------------------

    @Test
    void translate_passesLanguagesThrough() {
        when(capabilities.translate("Hola mundo", "Spanish", "English")).thenReturn("Hello world");

        StepResult result = new TranslateStep(capabilities).execute(ctx);

        assertThat(result.output()).isEqualTo("Hello world");
        assertThat(result.artifacts()).isEmpty();
    }

    @Test
    void translate_capabilityError_isHandlerFailure() {
        when(capabilities.translate(any(), any(), any())).thenThrow(new CapabilityException("HTTP 401"));

        assertThatThrownBy(() -> new TranslateStep(capabilities).execute(ctx))
                .isInstanceOf(StepException.class)
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.HANDLER_FAILURE));
    }

    // ------------------------------------------------------------------
    // TextToSpeechStep
    // ------------------------------------------------------------------

    @Test
    void textToSpeech_publishesMp3AndReturnsAudioArtifact() {
        byte[] audio = {7, 7, 7};
        when(capabilities.synthesizeSpeech("Hola mundo")).thenReturn(audio);
        when(publisher.publish(audio, "audio/mpeg")).thenReturn("https://gateway.pinata.cloud/ipfs/QmX");

        StepResult result = new TextToSpeechStep(capabilities, publisher).execute(ctx);

        assertThat(result.output()).isEqualTo("https://gateway.pinata.cloud/ipfs/QmX");
        assertThat(result.artifacts()).containsEntry("audio", "https://gateway.pinata.cloud/ipfs/QmX");
    }

    @Test
    void textToSpeech_publishError_isPublishErrorKind() {
        when(capabilities.synthesizeSpeech(any())).thenReturn(new byte[]{1});
        when(publisher.publish(any(), any())).thenThrow(new PublishException("pinFileToIPFS failed"));

        assertThatThrownBy(() -> new TextToSpeechStep(capabilities, publisher).execute(ctx))
                .isInstanceOf(StepException.class)
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.PUBLISH_ERROR));
    }

    @Test
    void textToSpeech_synthesisError_neverPublishes() {
        when(capabilities.synthesizeSpeech(any())).thenThrow(new CapabilityException("timeout"));

        assertThatThrownBy(() -> new TextToSpeechStep(capabilities, publisher).execute(ctx))
                .isInstanceOf(StepException.class);
        verifyNoInteractions(publisher);
    }

    // ------------------------------------------------------------------
    // DelegatedTextToSpeechStep
    // ------------------------------------------------------------------

    @Test
    void delegatedTextToSpeech_namesConfiguredCounterpartyAndRefusesLocalExecution() {
        DelegatedTextToSpeechStep step = new DelegatedTextToSpeechStep(new DelegationProperties(
                "translator-agent", "http://translator:8080", Duration.ofMinutes(5),
                new DelegationProperties.CounterpartyConfig("speech-agent", "http://speech:8081")));

        assertThat(step.manifest().mode()).isEqualTo(ExecutionMode.DELEGATED);
        assertThat(step.counterparty()).isEqualTo(new Counterparty("speech-agent", "http://speech:8081"));
        assertThatThrownBy(() -> step.execute(ctx)).isInstanceOf(UnsupportedOperationException.class);
    }
}
