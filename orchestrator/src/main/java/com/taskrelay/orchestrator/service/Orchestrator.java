package com.taskrelay.orchestrator.service;

import com.taskrelay.orchestrator.delegation.CounterpartyUnreachableException;
import com.taskrelay.orchestrator.delegation.DelegationChannel;
import com.taskrelay.orchestrator.delegation.ResultCallbackNotifier;
import com.taskrelay.orchestrator.delegation.SubtaskProgressEvent;
import com.taskrelay.orchestrator.delegation.SubtaskResolvedEvent;
import com.taskrelay.orchestrator.model.*;
import com.taskrelay.orchestrator.step.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.UUID;

/**
 * The task state machine.
 *
 * <pre>
 *   PENDING → RUNNING → { AWAITING_DELEGATE ⇄ RUNNING } → COMPLETED | FAILED
 * </pre>
 *
 * A drive loop ({@link #drive}) resolves the plan on first run, then executes
 * local steps one after another on its worker thread. When it reaches a
 * delegated step it hands the step to the {@link DelegationChannel} and
 * returns; the task holds no thread while it waits. The channel's
 * {@link SubtaskResolvedEvent} applies the outcome and dispatches the task
 * again at its next unresolved step.
 *
 * All state changes go through {@link TaskLedger}. Failures are fail-fast: the
 * first failed step fails the task and nothing is retried.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final TaskLedger             ledger;
    private final StepRegistry           registry;
    private final DelegationChannel      channel;
    private final TaskDispatcher         dispatcher;
    private final ResultCallbackNotifier notifier;

    public Orchestrator(TaskLedger ledger,
                        StepRegistry registry,
                        DelegationChannel channel,
                        TaskDispatcher dispatcher,
                        ResultCallbackNotifier notifier) {
        this.ledger     = ledger;
        this.registry   = registry;
        this.channel    = channel;
        this.dispatcher = dispatcher;
        this.notifier   = notifier;
    }

    // ------------------------------------------------------------------
    // Submission surface
    // ------------------------------------------------------------------

    /** Accept a task and start driving it; returns the PENDING task. */
    public Task submit(TaskInput input, List<String> intent) {
        Task task = ledger.create(input, intent);
        resume(task.getId());
        return task;
    }

    /**
     * Accept a task another agent delegated to us. Its outcome is reported to
     * {@code callbackUrl} once it is terminal.
     */
    public Task acceptDelegated(TaskInput input, List<String> intent,
                                String callerIdentity, String callbackUrl) {
        Task task = ledger.create(input, intent, callerIdentity, callbackUrl);
        resume(task.getId());
        return task;
    }

    public Task getStatus(UUID taskId) {
        return ledger.get(taskId);
    }

    /** Dispatch a drive loop for {@code taskId}; also used by startup recovery. */
    public void resume(UUID taskId) {
        dispatcher.dispatch(taskId, this::drive);
    }

    /**
     * Fail a non-terminal task with reason CANCELLED. If it was waiting on a
     * counterparty the subtask is abandoned; a result arriving later is discarded.
     *
     * @throws TaskNotFoundException if no such task exists
     * @throws IllegalStateException if the task is already terminal
     */
    public Task cancel(UUID taskId, String message) {
        Task task = ledger.cancel(taskId, message);
        int abandoned = channel.abandon(taskId);
        if (abandoned > 0) {
            log.info("Task {} cancelled; abandoned {} subtask(s)", taskId, abandoned);
        }
        notifier.notifyCaller(task);
        return task;
    }

    // ------------------------------------------------------------------
    // Drive loop (worker thread)
    // ------------------------------------------------------------------

    /**
     * Advance {@code taskId} as far as it can go without waiting.
     *
     * Returns when the task is terminal, AWAITING_DELEGATE, or was changed by
     * someone else (e.g. cancelled) while a step was running.
     */
    void drive(UUID taskId) {
        MDC.put("taskId", taskId.toString());
        try {
            Task task = ledger.get(taskId);
            boolean wasTerminal = task.isTerminal();

            if (task.getState() == TaskState.PENDING) {
                task = resolvePlan(task);
            }
            while (task.getState() == TaskState.RUNNING) {
                StepRecord step = task.currentStep().orElse(null);
                if (step == null) break;
                MDC.put("step", step.getName().wireName());
                if (!runStep(task, step)) break;
                task = ledger.get(taskId);
            }
            task = ledger.get(taskId);

            if (!wasTerminal && task.isTerminal()) {
                finish(task);
            }
        } catch (TaskNotFoundException e) {
            log.warn("Task {} disappeared before it could be driven", taskId);
        } catch (Exception e) {
            log.error("Task {} failed unexpectedly: {}", taskId, e.getMessage(), e);
            Task failed = ledger.fail(taskId, FailureReason.HANDLER_FAILURE,
                    "Unexpected orchestrator error: " + e.getMessage());
            finish(failed);
        } finally {
            MDC.remove("step");
            MDC.remove("taskId");
        }
    }

    private Task resolvePlan(Task task) {
        try {
            List<PlannedStep> plan = registry.resolve(task);
            return ledger.beginRunning(task.getId(), plan);
        } catch (UnknownStepException e) {
            return ledger.failResolution(task.getId(), e.getMessage());
        }
    }

    /**
     * Execute or delegate one step.
     *
     * @return true if the loop should reload the task and continue
     */
    private boolean runStep(Task task, StepRecord step) {
        UUID     taskId = task.getId();
        StepName name   = step.getName();

        StepHandler handler;
        try {
            handler = registry.lookup(name, step.getMode());
        } catch (UnknownStepException e) {
            // Handler configured at resolution time is gone (e.g. after a restart).
            ledger.fail(taskId, FailureReason.UNKNOWN_STEP, e.getMessage());
            return false;
        }

        String input = task.inputFor(step);
        Task started = ledger.startStep(taskId, name, input);
        boolean inProgress = started.getState() == TaskState.RUNNING
                && started.step(name).map(s -> s.getStatus() == StepStatus.IN_PROGRESS).orElse(false);
        if (!inProgress) {
            log.info("Step '{}' of task {} no longer runnable (task is {})",
                    name.wireName(), taskId, started.getState());
            return false;
        }

        if (handler instanceof DelegatedStepHandler delegated) {
            return delegate(taskId, name, input, delegated);
        }

        StepOutcome outcome;
        try {
            TaskInput source = task.getInput();
            StepResult result = registry.execute(handler, new StepExecutionContext(
                    taskId, input, source.sourceLanguage(), source.targetLanguage()));
            outcome = StepOutcome.success(result.output(), result.artifacts());
        } catch (StepException e) {
            outcome = StepOutcome.failure(e.failureReason(), e.getMessage());
        }
        ledger.applyStepOutcome(taskId, name, outcome);
        return true;
    }

    private boolean delegate(UUID taskId, StepName name, String input, DelegatedStepHandler handler) {
        DelegateRef ref;
        try {
            ref = channel.delegate(taskId, name, input, handler.counterparty());
        } catch (CounterpartyUnreachableException e) {
            ledger.applyStepOutcome(taskId, name,
                    StepOutcome.failure(FailureReason.COUNTERPARTY_UNREACHABLE, e.getMessage()));
            return true;
        }
        ledger.markDelegated(taskId, name, ref);
        // AWAITING_DELEGATE ends this pass; if the result already arrived the
        // task is RUNNING again and the loop carries on.
        return true;
    }

    // ------------------------------------------------------------------
    // Delegation events
    // ------------------------------------------------------------------

    /**
     * Runs inside the channel's delivery transaction: if applying throws, the
     * correlation entry survives. Resuming or notifying waits for the commit.
     */
    @EventListener
    public void onSubtaskResolved(SubtaskResolvedEvent event) {
        boolean applied = ledger.applyStepOutcome(event.taskId(), event.stepName(), event.outcome());
        if (!applied) {
            log.info("Outcome of subtask {} had no effect on task {}", event.remoteId(), event.taskId());
            return;
        }
        Task task = ledger.get(event.taskId());
        afterCommit(() -> {
            if (task.isTerminal()) {
                finish(task);
            } else {
                resume(task.getId());
            }
        });
    }

    @EventListener
    public void onSubtaskProgress(SubtaskProgressEvent event) {
        ledger.note(event.taskId(), TaskLogEntry.Level.INFO,
                "Subtask " + event.remoteId() + " reported " + event.status()
                + (event.message() != null ? ": " + event.message() : ""));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void finish(Task task) {
        if (task.getState() == TaskState.FAILED) {
            log.warn("Task {} FAILED ({}): {}", task.getId(), task.getFailureReason(), task.getFailureMessage());
        } else {
            log.info("Task {} COMPLETED with artifacts {}", task.getId(), task.getArtifacts().keySet());
        }
        notifier.notifyCaller(task);
    }
}
