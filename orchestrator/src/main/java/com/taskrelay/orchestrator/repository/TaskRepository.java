package com.taskrelay.orchestrator.repository;

import com.taskrelay.orchestrator.model.Task;
import com.taskrelay.orchestrator.model.TaskState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /**
     * Load a task and lock its row until the surrounding transaction ends.
     *
     * Every ledger mutation goes through here, which serializes transitions of
     * one task while leaving other tasks untouched. Must run inside a
     * {@code @Transactional} method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Task t WHERE t.id = :id")
    Optional<Task> findByIdForUpdate(@Param("id") UUID id);

    /** Tasks in any of the given states, oldest first (used by startup recovery). */
    List<Task> findByStateInOrderByCreatedAtAsc(Collection<TaskState> states);
}
