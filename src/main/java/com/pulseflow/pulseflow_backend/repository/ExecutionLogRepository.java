package com.pulseflow.pulseflow_backend.repository;

import com.pulseflow.pulseflow_backend.model.domain.ExecutionLog;
import com.pulseflow.pulseflow_backend.model.domain.NodeStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, UUID> {
    List<ExecutionLog> findByExecutionIdOrderByStartedAtAsc(UUID executionId);

    Optional<ExecutionLog> findFirstByExecutionIdAndNodeIdAndStatusOrderByStartedAtDesc(
            UUID executionId, String nodeId, NodeStatus status);
}
