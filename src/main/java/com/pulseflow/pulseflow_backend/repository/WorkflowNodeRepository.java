package com.pulseflow.pulseflow_backend.repository;

import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, UUID> {
    List<WorkflowNode> findByWorkflowId(UUID workflowId);
}
