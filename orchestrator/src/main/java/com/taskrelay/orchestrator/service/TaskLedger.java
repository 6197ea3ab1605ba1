package com.taskrelay.orchestrator.service;

import com.taskrelay.orchestrator.model.*;
import com.taskrelay.orchestrator.repository.TaskLogRepository;
import com.taskrelay.orchestrator.repository.TaskRepository;
import com.taskrelay.orchestrator.step.PlannedStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The durable record of every task, and the only code that mutates one.
 *
 * Each mutating method is one transaction that starts with
 * SELECT ... FOR UPDATE on the task row, so transitions of the same task are
 * serialized while different tasks never wait on each other. Every change
 * also appends a {@link TaskLogEntry}; that table is the audit trail.
 *
 * Methods that can arrive late or twice (outcomes, delegation marks) check
 * the current state first and turn into no-ops instead of throwing.
 */
@Service
public class TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(TaskLedger.class);

    private final TaskRepository    taskRepo;
    private final TaskLogRepository logRepo;

    public TaskLedger(TaskRepository taskRepo, TaskLogRepository logRepo) {
        this.taskRepo = taskRepo;
        this.logRepo  = logRepo;
    }

    // ------------------------------------------------------------------
    // Creation and reads
    // ------------------------------------------------------------------

    @Transactional
    public Task create(TaskInput input, List<String> intent) {
        return create(input, intent, null, null);
    }

    /**
     * Persist a new PENDING task. {@code callerIdentity} and {@code callbackUrl}
     * are set only for tasks another agent delegated to us.
     */
    @Transactional
    public Task create(TaskInput input, List<String> intent, String callerIdentity, String callbackUrl) {
        Task task = new Task(input, intent);
        if (callbackUrl != null) {
            task.setCallback(callerIdentity, callbackUrl);
        }
        task = taskRepo.save(task);
        audit(task, TaskLogEntry.Level.INFO, callerIdentity == null
                ? "Task accepted with intent " + task.getDeclaredIntent()
                : "Task accepted from " + callerIdentity + " with intent " + task.getDeclaredIntent());
        return task;
    }

    @Transactional(readOnly = true)
    public Optional<Task> find(UUID id) {
        return taskRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public Task get(UUID id) {
        return taskRepo.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<TaskLogEntry> logs(UUID id) {
        get(id);
        return logRepo.findByTaskIdOrderByCreatedAtAsc(id);
    }

    /** Tasks a worker was driving when the process stopped. */
    @Transactional(readOnly = true)
    public List<Task> findInterrupted() {
        return taskRepo.findByStateInOrderByCreatedAtAsc(
                EnumSet.of(TaskState.PENDING, TaskState.RUNNING));
    }

    // ------------------------------------------------------------------
    // Plan resolution
    // ------------------------------------------------------------------

    /**
     * PENDING → RUNNING with the resolved plan recorded as step records.
     * An empty plan completes the task straight away. A task that already
     * left PENDING is returned unchanged.
     */
    @Transactional
    public Task beginRunning(UUID id, List<PlannedStep> plan) {
        Task task = lock(id);
        if (task.getState() != TaskState.PENDING) {
            return task;
        }
        for (PlannedStep planned : plan) {
            task.addStep(planned.name(), planned.mode());
        }
        task.transitionTo(TaskState.RUNNING);
        audit(task, TaskLogEntry.Level.INFO, "Resolved plan " + describe(plan));
        completeIfFinished(task);
        return taskRepo.save(task);
    }

    /** PENDING → FAILED(UNKNOWN_STEP); no step records are created. */
    @Transactional
    public Task failResolution(UUID id, String message) {
        Task task = lock(id);
        if (task.getState() != TaskState.PENDING) {
            return task;
        }
        task.fail(FailureReason.UNKNOWN_STEP, message);
        audit(task, TaskLogEntry.Level.ERROR, "Plan resolution failed: " + message);
        return taskRepo.save(task);
    }

    // ------------------------------------------------------------------
    // Step progress
    // ------------------------------------------------------------------

    /**
     * Mark {@code name} IN_PROGRESS with its input. Only the current step of a
     * RUNNING task can be started; an IN_PROGRESS step is started again
     * (attempt + 1), which is how an interrupted step is re-executed.
     *
     * @return the task; its current step is IN_PROGRESS only if the start took effect
     */
    @Transactional
    public Task startStep(UUID id, StepName name, String input) {
        Task task = lock(id);
        if (task.getState() != TaskState.RUNNING) {
            return task;
        }
        StepRecord step = currentStep(task, name).orElse(null);
        if (step == null || step.getStatus().isFinished() || step.getStatus() == StepStatus.DELEGATED) {
            return task;
        }
        step.start(input);
        audit(task, TaskLogEntry.Level.INFO, step.getAttempt() == 1
                ? "Step '" + name.wireName() + "' started [" + step.getMode() + "]"
                : "Step '" + name.wireName() + "' restarted, attempt " + step.getAttempt());
        return taskRepo.save(task);
    }

    /**
     * IN_PROGRESS → DELEGATED and RUNNING → AWAITING_DELEGATE.
     *
     * No-op if the outcome already arrived (a fast counterparty can report
     * before the handoff is recorded) or the task was cancelled meanwhile.
     */
    @Transactional
    public Task markDelegated(UUID id, StepName name, DelegateRef ref) {
        Task task = lock(id);
        if (task.getState() != TaskState.RUNNING) {
            return task;
        }
        StepRecord step = currentStep(task, name).orElse(null);
        if (step == null || step.getStatus() != StepStatus.IN_PROGRESS) {
            return task;
        }
        step.delegated(ref);
        task.transitionTo(TaskState.AWAITING_DELEGATE);
        audit(task, TaskLogEntry.Level.INFO, "Step '" + name.wireName() + "' delegated to "
                + ref.counterpartyId() + " as subtask " + ref.remoteId());
        return taskRepo.save(task);
    }

    /**
     * Apply the outcome of step {@code name}.
     *
     * Idempotent per (task, step): the outcome is ignored when the task is
     * terminal, when the step is not the current one, or when the step is not
     * running or delegated (never started, or already finished).
     *
     * Success records the output, merges artifacts and, if that was the last
     * step, completes the task. Failure fails the task with the outcome's reason.
     *
     * @return true if the outcome changed the task
     */
    @Transactional
    public boolean applyStepOutcome(UUID id, StepName name, StepOutcome outcome) {
        Task task = lock(id);
        if (task.isTerminal()) {
            log.debug("Task {} is {}; ignoring outcome for '{}'", id, task.getState(), name.wireName());
            return false;
        }
        StepRecord step = currentStep(task, name).orElse(null);
        if (step == null
                || (step.getStatus() != StepStatus.IN_PROGRESS && step.getStatus() != StepStatus.DELEGATED)) {
            log.debug("Task {} step '{}' is not awaiting an outcome; ignoring", id, name.wireName());
            return false;
        }

        if (outcome.success()) {
            step.done(outcome.output());
            for (Map.Entry<String, String> artifact : outcome.artifacts().entrySet()) {
                addArtifact(task, artifact.getKey(), artifact.getValue());
            }
            if (task.getState() == TaskState.AWAITING_DELEGATE) {
                task.transitionTo(TaskState.RUNNING);
            }
            audit(task, TaskLogEntry.Level.INFO, "Step '" + name.wireName() + "' done");
            completeIfFinished(task);
        } else {
            step.failed(outcome.message());
            task.fail(outcome.failureReason(), outcome.message());
            audit(task, TaskLogEntry.Level.ERROR, "Step '" + name.wireName() + "' failed ("
                    + outcome.failureReason() + "): " + outcome.message());
        }
        taskRepo.save(task);
        return true;
    }

    // ------------------------------------------------------------------
    // Failure and cancellation
    // ------------------------------------------------------------------

    /**
     * Fail a task outside of a step outcome, e.g. when the worker loop hits an
     * unexpected error. No-op on a terminal task.
     */
    @Transactional
    public Task fail(UUID id, FailureReason reason, String message) {
        Task task = lock(id);
        if (task.isTerminal()) {
            return task;
        }
        failCurrentStep(task, message);
        task.fail(reason, message);
        audit(task, TaskLogEntry.Level.ERROR, "Task failed (" + reason + "): " + message);
        return taskRepo.save(task);
    }

    /**
     * Any non-terminal state → FAILED(CANCELLED).
     *
     * @throws IllegalStateException if the task already finished
     */
    @Transactional
    public Task cancel(UUID id, String message) {
        Task task = lock(id);
        if (task.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is already " + task.getState());
        }
        failCurrentStep(task, message);
        task.fail(FailureReason.CANCELLED, message);
        audit(task, TaskLogEntry.Level.WARN, "Task cancelled: " + message);
        return taskRepo.save(task);
    }

    // ------------------------------------------------------------------
    // Annotations
    // ------------------------------------------------------------------

    /**
     * Record an artifact. Allowed on terminal tasks; an existing name is never
     * overwritten.
     *
     * @return false if the name was already taken
     */
    @Transactional
    public boolean appendArtifact(UUID id, String name, String locator) {
        Task task = lock(id);
        boolean added = addArtifact(task, name, locator);
        taskRepo.save(task);
        return added;
    }

    /** Append a free-form line to the task's audit trail without touching its state. */
    @Transactional
    public void note(UUID id, TaskLogEntry.Level level, String message) {
        Task task = get(id);
        audit(task, level, message);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task lock(UUID id) {
        return taskRepo.findByIdForUpdate(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /** The step named {@code name}, if it is where execution currently stands. */
    private static Optional<StepRecord> currentStep(Task task, StepName name) {
        return task.currentStep().filter(s -> s.getName() == name);
    }

    private void completeIfFinished(Task task) {
        if (task.getState() == TaskState.RUNNING && task.currentStep().isEmpty()) {
            task.transitionTo(TaskState.COMPLETED);
            audit(task, TaskLogEntry.Level.INFO, "Task completed with artifacts " + task.getArtifacts().keySet());
        }
    }

    private void failCurrentStep(Task task, String message) {
        task.currentStep()
                .filter(s -> s.getStatus() == StepStatus.IN_PROGRESS || s.getStatus() == StepStatus.DELEGATED)
                .ifPresent(s -> s.failed(message));
    }

    private boolean addArtifact(Task task, String name, String locator) {
        boolean added = task.putArtifactIfAbsent(name, locator);
        if (added) {
            audit(task, TaskLogEntry.Level.INFO, "Artifact '" + name + "' → " + locator);
        } else {
            log.warn("Task {} already has artifact '{}'; keeping the existing locator", task.getId(), name);
        }
        return added;
    }

    private void audit(Task task, TaskLogEntry.Level level, String message) {
        logRepo.save(new TaskLogEntry(task.getId(), level, message, task.getState()));
        switch (level) {
            case INFO  -> log.info("Task {} [{}] {}", task.getId(), task.getState(), message);
            case WARN  -> log.warn("Task {} [{}] {}", task.getId(), task.getState(), message);
            case ERROR -> log.error("Task {} [{}] {}", task.getId(), task.getState(), message);
        }
    }

    private static String describe(List<PlannedStep> plan) {
        if (plan.isEmpty()) return "[]";
        return plan.stream()
                .map(p -> p.name().wireName() + "/" + p.mode().name().toLowerCase())
                .toList()
                .toString();
    }
}
