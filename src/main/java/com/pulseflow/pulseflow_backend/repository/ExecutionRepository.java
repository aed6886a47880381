package com.pulseflow.pulseflow_backend.repository;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<Execution, UUID> {
    List<Execution> findByWorkflowIdOrderByStartedAtDesc(UUID workflowId);

    // Stop requests target the newest run still in flight
    Optional<Execution> findFirstByWorkflowIdAndStatusOrderByStartedAtDesc(UUID workflowId, ExecutionStatus status);

    /** Compare-and-set on the status column. Returns the number of rows changed (0 or 1). */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update Execution e set e.status = :next, e.version = e.version + 1 "
            + "where e.id = :id and e.status = :expected")
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") ExecutionStatus expected,
                         @Param("next") ExecutionStatus next);

    /** Fails every run still RUNNING that started before the cutoff. */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update Execution e set e.status = com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus.FAILED, "
            + "e.error = :error, e.completedAt = :now, e.version = e.version + 1 "
            + "where e.status = com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus.RUNNING "
            + "and e.startedAt < :cutoff")
    int failRunningStartedBefore(@Param("cutoff") Instant cutoff,
                                 @Param("error") String error,
                                 @Param("now") Instant now);
}
