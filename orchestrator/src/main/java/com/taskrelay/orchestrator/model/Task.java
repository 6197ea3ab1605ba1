package com.taskrelay.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One unit of work submitted to the agent.
 *
 * A Task owns its ordered StepRecords and its artifact map. Only TaskLedger
 * mutates a Task, always under a row lock, so the guards below see a
 * consistent view.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "input_text", nullable = false, columnDefinition = "TEXT")
    private String inputText;

    @Column(name = "source_language", nullable = false)
    private String sourceLanguage;

    @Column(name = "target_language", nullable = false)
    private String targetLanguage;

    // Intent tokens exactly as submitted, comma-separated. Resolution happens
    // later, so an unknown token still produces a (failed) task.
    @Column(name = "declared_intent", nullable = false)
    private String declaredIntent = "";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state = TaskState.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason")
    private FailureReason failureReason;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;

    // Set only for tasks another agent delegated to us through the agent inbox.
    @Column(name = "caller_identity")
    private String callerIdentity;

    @Column(name = "callback_url")
    private String callbackUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Plans are at most a handful of steps; always load them with the task.
    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @OrderBy("position ASC")
    private List<StepRecord> steps = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_artifacts", joinColumns = @JoinColumn(name = "task_id"))
    @MapKeyColumn(name = "name")
    @Column(name = "locator", nullable = false)
    private Map<String, String> artifacts = new LinkedHashMap<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(TaskInput input, List<String> intent) {
        this.inputText      = input.text();
        this.sourceLanguage = input.sourceLanguage();
        this.targetLanguage = input.targetLanguage();
        this.declaredIntent = intent == null ? "" : String.join(",", intent);
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}, enforcing the forward-only lifecycle.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(TaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task " + id + ": illegal transition " + state + " → " + next);
        }
        this.state = next;
    }

    public void fail(FailureReason reason, String message) {
        transitionTo(TaskState.FAILED);
        this.failureReason  = reason;
        this.failureMessage = message;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Append a planned step; position follows insertion order. */
    public StepRecord addStep(StepName name, ExecutionMode mode) {
        StepRecord step = new StepRecord(this, name, mode, steps.size());
        steps.add(step);
        return step;
    }

    /** The first step that is not DONE, i.e. where execution resumes. */
    public Optional<StepRecord> currentStep() {
        return steps.stream()
                .filter(s -> s.getStatus() != StepStatus.DONE)
                .findFirst();
    }

    public Optional<StepRecord> step(StepName name) {
        return steps.stream().filter(s -> s.getName() == name).findFirst();
    }

    /**
     * Input for the step at {@code position}: the previous step's output, or
     * the task's own text for the first step.
     */
    public String inputFor(StepRecord step) {
        int pos = step.getPosition();
        if (pos == 0) return inputText;
        String previous = steps.get(pos - 1).getOutput();
        return previous != null ? previous : inputText;
    }

    /** Artifacts are never replaced; returns false if the name was already taken. */
    public boolean putArtifactIfAbsent(String name, String locator) {
        return artifacts.putIfAbsent(name, locator) == null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()             { return id; }
    public String        getInputText()      { return inputText; }
    public String        getSourceLanguage() { return sourceLanguage; }
    public String        getTargetLanguage() { return targetLanguage; }
    public TaskState     getState()          { return state; }
    public FailureReason getFailureReason()  { return failureReason; }
    public String        getFailureMessage() { return failureMessage; }
    public String        getCallerIdentity() { return callerIdentity; }
    public String        getCallbackUrl()    { return callbackUrl; }
    public Instant       getCreatedAt()      { return createdAt; }
    public Instant       getUpdatedAt()      { return updatedAt; }

    public List<StepRecord>    getSteps()     { return Collections.unmodifiableList(steps); }
    public Map<String, String> getArtifacts() { return Collections.unmodifiableMap(artifacts); }

    public TaskInput getInput() {
        return new TaskInput(inputText, sourceLanguage, targetLanguage);
    }

    public List<String> getDeclaredIntent() {
        if (declaredIntent == null || declaredIntent.isBlank()) return List.of();
        return Arrays.stream(declaredIntent.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public void setCallback(String callerIdentity, String callbackUrl) {
        this.callerIdentity = callerIdentity;
        this.callbackUrl    = callbackUrl;
    }
}
