package com.taskrelay.orchestrator.repository;

import com.taskrelay.orchestrator.model.Subtask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Correlation entries for in-flight delegated steps.
 */
public interface SubtaskRepository extends JpaRepository<Subtask, UUID> {

    Optional<Subtask> findByRemoteId(String remoteId);

    List<Subtask> findByParentTaskId(UUID parentTaskId);

    /** Entries whose deadline is before {@code cutoff}; the timeout sweep reads these. */
    List<Subtask> findByDeadlineBefore(Instant cutoff);

    /**
     * Remove the entry for a remote id and report how many rows went away.
     *
     * This is the consume step of result delivery: when a result, a timeout
     * and a cancellation race for the same entry, only the caller that sees
     * 1 here owns the outcome. Everybody else sees 0 and drops theirs.
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM Subtask s WHERE s.remoteId = :remoteId")
    int deleteByRemoteId(@Param("remoteId") String remoteId);
}
