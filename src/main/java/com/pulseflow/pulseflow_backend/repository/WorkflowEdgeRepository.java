package com.pulseflow.pulseflow_backend.repository;

import com.pulseflow.pulseflow_backend.model.domain.WorkflowEdge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowEdgeRepository extends JpaRepository<WorkflowEdge, UUID> {
    List<WorkflowEdge> findByWorkflowId(UUID workflowId);
}
