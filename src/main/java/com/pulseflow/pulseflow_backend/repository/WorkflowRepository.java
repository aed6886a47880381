package com.pulseflow.pulseflow_backend.repository;

import com.pulseflow.pulseflow_backend.model.domain.TriggerMode;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    // Scheduled workflows whose next run is due
    List<Workflow> findByTriggerModeAndNextRunAtLessThanEqual(TriggerMode triggerMode, Instant now);
}
