package com.taskrelay.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of a task's audit trail.
 *
 * Written by TaskLedger for every transition and by the delegation channel
 * for counterparty progress reports. Append-only.
 *
 * DB table: task_logs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_logs")
public class TaskLogEntry {

    public enum Level { INFO, WARN, ERROR }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Level level;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    // Task state right after the logged event.
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected TaskLogEntry() {}   // required by JPA

    public TaskLogEntry(UUID taskId, Level level, String message, TaskState state) {
        this.taskId  = taskId;
        this.level   = level;
        this.message = message;
        this.state   = state;
    }

    public UUID      getId()        { return id; }
    public UUID      getTaskId()    { return taskId; }
    public Level     getLevel()     { return level; }
    public String    getMessage()   { return message; }
    public TaskState getState()     { return state; }
    public Instant   getCreatedAt() { return createdAt; }
}
