package com.taskrelay.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Correlation entry for a step delegated to a counterparty agent.
 *
 * The subtask itself lives on the counterparty; this row only links its
 * remote id back to the parent task and step. parentTaskId is a plain column,
 * not a relation: the delegation channel never loads or mutates the Task.
 *
 * The row is deleted as soon as the subtask resolves (result, timeout or
 * cancellation), so a missing row means "already handled".
 *
 * DB table: subtasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "subtasks")
public class Subtask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "remote_id", nullable = false, unique = true)
    private String remoteId;

    @Column(name = "counterparty_id", nullable = false)
    private String counterpartyId;

    // Where to send a best-effort abandon if the parent task is cancelled.
    @Column(name = "counterparty_url", nullable = false)
    private String counterpartyUrl;

    @Column(name = "parent_task_id", nullable = false)
    private UUID parentTaskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "parent_step_name", nullable = false)
    private StepName parentStepName;

    // Last status the counterparty reported (Pending, InProgress, ...).
    @Column(nullable = false)
    private String status = "Pending";

    @Column(nullable = false)
    private Instant deadline;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Subtask() {}   // required by JPA

    public Subtask(String remoteId, String counterpartyId, String counterpartyUrl,
                   UUID parentTaskId, StepName parentStepName, Instant deadline) {
        this.remoteId        = remoteId;
        this.counterpartyId  = counterpartyId;
        this.counterpartyUrl = counterpartyUrl;
        this.parentTaskId    = parentTaskId;
        this.parentStepName  = parentStepName;
        this.deadline        = deadline;
    }

    public UUID     getId()             { return id; }
    public String   getRemoteId()       { return remoteId; }
    public String   getCounterpartyId() { return counterpartyId; }
    public String   getCounterpartyUrl() { return counterpartyUrl; }
    public UUID     getParentTaskId()   { return parentTaskId; }
    public StepName getParentStepName() { return parentStepName; }
    public String   getStatus()         { return status; }
    public Instant  getDeadline()       { return deadline; }
    public Instant  getCreatedAt()      { return createdAt; }

    public void setStatus(String status) { this.status = status; }

    public boolean isExpired(Instant now) {
        return deadline.isBefore(now);
    }
}
