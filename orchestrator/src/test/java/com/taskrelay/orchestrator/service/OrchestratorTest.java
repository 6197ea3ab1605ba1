package com.taskrelay.orchestrator.service;

import com.taskrelay.orchestrator.capability.CapabilityException;
import com.taskrelay.orchestrator.capability.CapabilityProvider;
import com.taskrelay.orchestrator.delegation.*;
import com.taskrelay.orchestrator.delegation.dto.SubtaskResultReport;
import com.taskrelay.orchestrator.model.*;
import com.taskrelay.orchestrator.publisher.ArtifactPublisher;
import com.taskrelay.orchestrator.publisher.PublishException;
import com.taskrelay.orchestrator.step.PlannedStep;
import com.taskrelay.orchestrator.step.StepRegistry;
import com.taskrelay.orchestrator.step.impl.DelegatedTextToSpeechStep;
import com.taskrelay.orchestrator.step.impl.TextToSpeechStep;
import com.taskrelay.orchestrator.step.impl.TranslateStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of the task state machine.
 *
 * Real ledger, registry, handlers and delegation channel; repositories are
 * in-memory mocks and the outside world (OpenAI, Pinata, counterparties) is
 * mocked. The dispatcher runs drive loops on the calling thread, so every
 * call below returns only once the task has gone as far as it can.
 */
@ExtendWith(MockitoExtension.class)
class OrchestratorTest {

    static final String SPEECH_AGENT_URL = "http://speech-agent:8081";

    @Mock CapabilityProvider capabilities;
    @Mock ArtifactPublisher  publisher;
    @Mock CounterpartyClient client;

    InMemoryRepositories store;
    TaskLedger           ledger;
    DelegationChannel    channel;
    Orchestrator         orchestrator;

    @BeforeEach
    void setUp() {
        store  = new InMemoryRepositories();
        ledger = new TaskLedger(store.taskRepo, store.logRepo);

        DelegationProperties properties = new DelegationProperties(
                "translator-agent", "http://translator:8080", Duration.ofMinutes(10),
                new DelegationProperties.CounterpartyConfig("speech-agent", SPEECH_AGENT_URL));

        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        StepRegistry registry = new StepRegistry(List.of(
                new TranslateStep(capabilities),
                new TextToSpeechStep(capabilities, publisher),
                new DelegatedTextToSpeechStep(properties)), meters);

        // Same routing Spring does for the orchestrator's @EventListener methods.
        ApplicationEventPublisher events = event -> {
            if (event instanceof SubtaskResolvedEvent resolved) orchestrator.onSubtaskResolved(resolved);
            if (event instanceof SubtaskProgressEvent progress) orchestrator.onSubtaskProgress(progress);
        };
        channel = new DelegationChannel(store.subtaskRepo, client, properties, events, meters,
                store.transactionManager());

        orchestrator = new Orchestrator(ledger, registry, channel,
                new TaskDispatcher(Runnable::run), new ResultCallbackNotifier(client));
    }

    // ------------------------------------------------------------------
    // Local plans
    // ------------------------------------------------------------------

    @Test
    void translateOnly_completesWithOneLocalInvocationAndNoArtifacts() {
        when(capabilities.translate("Hola mundo", "Spanish", "English")).thenReturn("Hello world");

        Task task = submit("Hola mundo", "translate");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.getSteps()).extracting(StepRecord::getName).containsExactly(StepName.TRANSLATE);
        assertThat(status.getSteps().get(0).getOutput()).isEqualTo("Hello world");
        assertThat(status.getArtifacts()).isEmpty();
        verify(capabilities, times(1)).translate(any(), any(), any());
        verifyNoInteractions(publisher, client);
    }

    @Test
    void translateThenLocalSpeech_publishesAudioArtifact() {
        byte[] audio = {1, 2, 3};
        when(capabilities.translate("Hola", "Spanish", "English")).thenReturn("Hello");
        when(capabilities.synthesizeSpeech("Hello")).thenReturn(audio);
        when(publisher.publish(audio, "audio/mpeg")).thenReturn("https://gateway.pinata.cloud/ipfs/QmAudio");

        Task task = submit("Hola", "text2speech-local", "translate");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.getSteps()).extracting(StepRecord::getName)
                .containsExactly(StepName.TRANSLATE, StepName.TEXT2SPEECH);
        assertThat(status.getSteps()).extracting(StepRecord::getStatus).containsOnly(StepStatus.DONE);
        assertThat(status.getArtifacts())
                .containsExactly(Map.entry("audio", "https://gateway.pinata.cloud/ipfs/QmAudio"));
    }

    @Test
    void noIntent_completesWithoutSteps() {
        Task task = submit("Hola");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.getSteps()).isEmpty();
        verifyNoInteractions(capabilities);
    }

    @Test
    void unknownIntent_failsWithUnknownStepAndNoStepRecords() {
        Task task = submit("Hola", "translate", "summarize");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.UNKNOWN_STEP);
        assertThat(status.getFailureMessage()).contains("summarize");
        assertThat(status.getSteps()).isEmpty();
        verifyNoInteractions(capabilities);
    }

    @Test
    void localHandlerFailure_failsFastWithoutRunningLaterSteps() {
        when(capabilities.translate(any(), any(), any()))
                .thenThrow(new CapabilityException("HTTP 503: overloaded"));

        Task task = submit("Hola", "translate", "text2speech-local");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.HANDLER_FAILURE);
        assertThat(status.step(StepName.TEXT2SPEECH).orElseThrow().getStatus()).isEqualTo(StepStatus.NOT_STARTED);
        verify(capabilities, never()).synthesizeSpeech(any());
        verify(capabilities, times(1)).translate(any(), any(), any());
    }

    @Test
    void publishFailure_failsWithPublishError() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(capabilities.synthesizeSpeech("Hello")).thenReturn(new byte[]{1});
        when(publisher.publish(any(), any())).thenThrow(new PublishException("Failed to upload file to Pinata"));

        Task task = submit("Hola", "translate", "text2speech-local");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.PUBLISH_ERROR);
        assertThat(status.getArtifacts()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Delegated plans
    // ------------------------------------------------------------------

    @Test
    void delegatedSpeech_awaitsDelegateThenCompletesOnResult() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), eq(StepName.TEXT2SPEECH), eq("Hello"),
                eq("translator-agent"), eq("http://translator:8080/subtasks"))).thenReturn("remote-1");

        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task awaiting = orchestrator.getStatus(task.getId());
        assertThat(awaiting.getState()).isEqualTo(TaskState.AWAITING_DELEGATE);
        assertThat(awaiting.step(StepName.TRANSLATE).orElseThrow().getStatus()).isEqualTo(StepStatus.DONE);
        assertThat(awaiting.step(StepName.TEXT2SPEECH).orElseThrow().getDelegateRef())
                .contains(new DelegateRef("speech-agent", "remote-1"));
        assertThat(store.subtasks).containsKey("remote-1");

        boolean forwarded = channel.onSubtaskResult("remote-1",
                StepOutcome.success("ipfs://QmRemote", Map.of("audio", "ipfs://QmRemote")));

        Task done = orchestrator.getStatus(task.getId());
        assertThat(forwarded).isTrue();
        assertThat(done.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.getArtifacts()).containsEntry("audio", "ipfs://QmRemote");
        assertThat(done.getSteps()).extracting(StepRecord::getStatus).containsOnly(StepStatus.DONE);
        assertThat(store.subtasks).isEmpty();
        verify(capabilities, never()).synthesizeSpeech(any());
    }

    @Test
    void delegatedSpeech_duplicateResult_isDiscarded() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");
        channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://first"));

        boolean second = channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://second"));

        Task status = orchestrator.getStatus(task.getId());
        assertThat(second).isFalse();
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.step(StepName.TEXT2SPEECH).orElseThrow().getOutput()).isEqualTo("ipfs://first");
    }

    @Test
    void delegatedSpeech_counterpartyReportsFailure_failsTask() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");

        channel.onSubtaskResult("remote-1", SubtaskResultReport.failed("voice model offline").toOutcome());

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.HANDLER_FAILURE);
        assertThat(status.getFailureMessage()).isEqualTo("voice model offline");
    }

    @Test
    void delegatedSpeech_deadlinePasses_failsTimedOutAndLateResultIsNoOp() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");

        int timedOut = channel.sweepExpired(Instant.now().plus(Duration.ofHours(1)));

        Task failed = orchestrator.getStatus(task.getId());
        assertThat(timedOut).isEqualTo(1);
        assertThat(failed.getState()).isEqualTo(TaskState.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.TIMED_OUT);
        int logsBefore = store.logMessages(task.getId()).size();

        boolean late = channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://late"));

        Task after = orchestrator.getStatus(task.getId());
        assertThat(late).isFalse();
        assertThat(after.getState()).isEqualTo(TaskState.FAILED);
        assertThat(after.getFailureReason()).isEqualTo(FailureReason.TIMED_OUT);
        assertThat(after.getArtifacts()).isEmpty();
        assertThat(store.logMessages(task.getId())).hasSize(logsBefore);
    }

    @Test
    void delegatedSpeech_sweepBeforeDeadline_leavesTaskAwaiting() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");

        int timedOut = channel.sweepExpired(Instant.now());

        assertThat(timedOut).isZero();
        assertThat(orchestrator.getStatus(task.getId()).getState()).isEqualTo(TaskState.AWAITING_DELEGATE);
    }

    @Test
    void delegatedSpeech_counterpartyUnreachable_failsTask() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any()))
                .thenThrow(new CounterpartyException("createSubtask on speech-agent failed"));

        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.COUNTERPARTY_UNREACHABLE);
        assertThat(store.subtasks).isEmpty();
    }

    @Test
    void delegatedSpeech_progressReport_isLoggedWithoutStateChange() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");

        boolean tracked = channel.onSubtaskProgress("remote-1", "In_Progress", "synthesizing");

        assertThat(tracked).isTrue();
        assertThat(orchestrator.getStatus(task.getId()).getState()).isEqualTo(TaskState.AWAITING_DELEGATE);
        assertThat(store.subtasks.get("remote-1").getStatus()).isEqualTo("In_Progress");
        assertThat(store.logMessages(task.getId()))
                .anyMatch(m -> m.contains("remote-1") && m.contains("In_Progress"));
    }

    @Test
    void delegatedSpeech_applyingResultFails_entryKeptAndRedeliveryCompletesTask() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");
        failNextLock(task);

        assertThatThrownBy(() -> channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://QmRemote")))
                .hasMessage("db connection reset");
        assertThat(store.subtasks).containsKey("remote-1");
        assertThat(orchestrator.getStatus(task.getId()).getState()).isEqualTo(TaskState.AWAITING_DELEGATE);

        boolean redelivered = channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://QmRemote"));

        Task done = orchestrator.getStatus(task.getId());
        assertThat(redelivered).isTrue();
        assertThat(done.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(done.step(StepName.TEXT2SPEECH).orElseThrow().getOutput()).isEqualTo("ipfs://QmRemote");
        assertThat(store.subtasks).isEmpty();
    }

    @Test
    void delegatedSpeech_timeoutFailsToApply_otherEntriesStillSweptAndNextSweepRetries() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1", "remote-2");
        Task first  = submit("Hola", "translate", "text2speech-delegated");
        Task second = submit("Buenos días", "translate", "text2speech-delegated");
        failNextLock(first);
        Instant later = Instant.now().plus(Duration.ofHours(1));

        int firstSweep = channel.sweepExpired(later);

        assertThat(firstSweep).isEqualTo(1);
        assertThat(orchestrator.getStatus(first.getId()).getState()).isEqualTo(TaskState.AWAITING_DELEGATE);
        assertThat(orchestrator.getStatus(second.getId()).getFailureReason()).isEqualTo(FailureReason.TIMED_OUT);
        assertThat(store.subtasks).containsOnlyKeys("remote-1");

        int secondSweep = channel.sweepExpired(later);

        Task failed = orchestrator.getStatus(first.getId());
        assertThat(secondSweep).isEqualTo(1);
        assertThat(failed.getState()).isEqualTo(TaskState.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.TIMED_OUT);
        assertThat(store.subtasks).isEmpty();
    }

    @Test
    void delegatedSpeech_failureReportedBeforeHandoffReturns_failsWithReportedReason() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenAnswer(inv -> {
            boolean forwarded = channel.onSubtaskResult("remote-1",
                    SubtaskResultReport.failed("voice model offline").toOutcome());
            assertThat(forwarded).isFalse();
            return "remote-1";
        });

        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.FAILED);
        assertThat(status.getFailureReason()).isEqualTo(FailureReason.HANDLER_FAILURE);
        assertThat(status.getFailureMessage()).isEqualTo("voice model offline");
        assertThat(store.subtasks).isEmpty();
    }

    @Test
    void delegatedSpeech_completionReportedBeforeHandoffReturns_completesTask() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenAnswer(inv -> {
            channel.onSubtaskResult("remote-1",
                    StepOutcome.success("ipfs://QmFast", Map.of("audio", "ipfs://QmFast")));
            return "remote-1";
        });

        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.getArtifacts()).containsEntry("audio", "ipfs://QmFast");
        assertThat(status.step(StepName.TEXT2SPEECH).orElseThrow().getDelegateRef()).isEmpty();
        assertThat(store.subtasks).isEmpty();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancel_awaitingTask_abandonsSubtaskAndDiscardsLateResult() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task cancelled = orchestrator.cancel(task.getId(), "caller gave up");

        assertThat(cancelled.getState()).isEqualTo(TaskState.FAILED);
        assertThat(cancelled.getFailureReason()).isEqualTo(FailureReason.CANCELLED);
        verify(client).cancelSubtask(SPEECH_AGENT_URL, "remote-1");
        assertThat(channel.onSubtaskResult("remote-1", StepOutcome.success("ipfs://late"))).isFalse();
        assertThat(orchestrator.getStatus(task.getId()).getFailureReason()).isEqualTo(FailureReason.CANCELLED);
    }

    @Test
    void cancel_counterpartyRejectsAbandon_taskStillCancelled() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        when(client.createSubtask(any(), any(), any(), any(), any())).thenReturn("remote-1");
        doThrow(new CounterpartyException("connection refused")).when(client).cancelSubtask(any(), any());
        Task task = submit("Hola", "translate", "text2speech-delegated");

        Task cancelled = orchestrator.cancel(task.getId(), "caller gave up");

        assertThat(cancelled.getFailureReason()).isEqualTo(FailureReason.CANCELLED);
        assertThat(store.subtasks).isEmpty();
    }

    @Test
    void cancel_completedTask_isRejected() {
        Task task = submit("Hola");

        assertThatThrownBy(() -> orchestrator.cancel(task.getId(), "too late"))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Tasks delegated to us
    // ------------------------------------------------------------------

    @Test
    void acceptDelegated_reportsResultToCallerOnCompletion() {
        when(capabilities.translate("Hola", "Spanish", "English")).thenReturn("Hello");

        Task task = orchestrator.acceptDelegated(TaskInput.of("Hola"), List.of("translate"),
                "planner-agent", "http://planner:9000/subtasks");

        ArgumentCaptor<SubtaskResultReport> report = ArgumentCaptor.forClass(SubtaskResultReport.class);
        verify(client).reportResult(eq("http://planner:9000/subtasks"), eq(task.getId().toString()), report.capture());
        assertThat(report.getValue().status()).isEqualTo("Completed");
        assertThat(report.getValue().output()).isEqualTo("Hello");
    }

    @Test
    void acceptDelegated_reportsFailureToCaller() {
        when(capabilities.translate(any(), any(), any())).thenThrow(new CapabilityException("quota exceeded"));

        Task task = orchestrator.acceptDelegated(TaskInput.of("Hola"), List.of("translate"),
                "planner-agent", "http://planner:9000/subtasks");

        ArgumentCaptor<SubtaskResultReport> report = ArgumentCaptor.forClass(SubtaskResultReport.class);
        verify(client).reportResult(eq("http://planner:9000/subtasks"), eq(task.getId().toString()), report.capture());
        assertThat(report.getValue().status()).isEqualTo("Failed");
        assertThat(report.getValue().message()).contains("HANDLER_FAILURE");
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    @Test
    void resume_interruptedInProgressStep_isReExecuted() {
        when(capabilities.translate(any(), any(), any())).thenReturn("Hello");
        Task task = ledger.create(TaskInput.of("Hola"), List.of("translate"));
        ledger.beginRunning(task.getId(), List.of(
                new PlannedStep(StepName.TRANSLATE, ExecutionMode.LOCAL)));
        ledger.startStep(task.getId(), StepName.TRANSLATE, "Hola");   // worker died here

        new TaskRecovery(ledger, orchestrator).recoverInterruptedTasks();

        Task status = orchestrator.getStatus(task.getId());
        assertThat(status.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.step(StepName.TRANSLATE).orElseThrow().getAttempt()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The next row lock on {@code task} fails like a dropped connection; later ones succeed. */
    private void failNextLock(Task task) {
        doThrow(new IllegalStateException("db connection reset"))
                .doAnswer(inv -> Optional.ofNullable(store.tasks.get(task.getId())))
                .when(store.taskRepo).findByIdForUpdate(task.getId());
    }

    private Task submit(String text, String... intent) {
        return orchestrator.submit(TaskInput.of(text), List.of(intent));
    }
}
