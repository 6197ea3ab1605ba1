package com.taskrelay.orchestrator.repository;

import com.taskrelay.orchestrator.model.TaskLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TaskLogRepository extends JpaRepository<TaskLogEntry, UUID> {

    /** Audit trail for one task, oldest first. */
    List<TaskLogEntry> findByTaskIdOrderByCreatedAtAsc(UUID taskId);
}
