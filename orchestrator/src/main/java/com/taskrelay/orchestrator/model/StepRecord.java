package com.taskrelay.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One planned step of a Task.
 *
 * Created when the orchestrator resolves the plan, never deleted. Status moves
 * NOT_STARTED → IN_PROGRESS → (DELEGATED →) DONE | FAILED.
 *
 * DB table: step_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_records")
public class StepRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepName name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionMode mode;

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.NOT_STARTED;

    @Column(columnDefinition = "TEXT")
    private String input;

    @Column(columnDefinition = "TEXT")
    private String output;

    // Kept after the step finishes so the audit trail shows who ran it.
    @Column(name = "counterparty_id")
    private String counterpartyId;

    @Column(name = "remote_id")
    private String remoteId;

    // Incremented each time the step is (re)started; > 1 only after a restart.
    @Column(nullable = false)
    private int attempt = 0;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepRecord() {}   // required by JPA

    StepRecord(Task task, StepName name, ExecutionMode mode, int position) {
        this.task     = task;
        this.name     = name;
        this.mode     = mode;
        this.position = position;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start(String input) {
        this.status    = StepStatus.IN_PROGRESS;
        this.input     = input;
        this.startedAt = Instant.now();
        this.attempt++;
    }

    public void delegated(DelegateRef ref) {
        this.status         = StepStatus.DELEGATED;
        this.counterpartyId = ref.counterpartyId();
        this.remoteId       = ref.remoteId();
    }

    public void done(String output) {
        this.status     = StepStatus.DONE;
        this.output     = output;
        this.finishedAt = Instant.now();
    }

    public void failed(String message) {
        this.status     = StepStatus.FAILED;
        this.output     = message;
        this.finishedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID          getId()         { return id; }
    public Task          getTask()       { return task; }
    public StepName      getName()       { return name; }
    public ExecutionMode getMode()       { return mode; }
    public int           getPosition()   { return position; }
    public StepStatus    getStatus()     { return status; }
    public String        getInput()      { return input; }
    public String        getOutput()     { return output; }
    public int           getAttempt()    { return attempt; }
    public Instant       getStartedAt()  { return startedAt; }
    public Instant       getFinishedAt() { return finishedAt; }

    /** Present only while the step is waiting on its counterparty. */
    public Optional<DelegateRef> getDelegateRef() {
        if (status != StepStatus.DELEGATED || remoteId == null) return Optional.empty();
        return Optional.of(new DelegateRef(counterpartyId, remoteId));
    }
}
