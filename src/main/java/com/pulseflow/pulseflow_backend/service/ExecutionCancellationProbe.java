package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.engine.CancellationProbe;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * A run is cancelled once its execution row has left RUNNING while the engine still holds it:
 * a stop request sets CANCELLED, the stale-run sweeper sets FAILED.
 */
@Component
@RequiredArgsConstructor
public class ExecutionCancellationProbe implements CancellationProbe {

    private final ExecutionRepository executionRepository;

    @Override
    public boolean isCancelled(String executionId) {
        return executionRepository.findById(UUID.fromString(executionId))
                .map(e -> e.getStatus() != ExecutionStatus.RUNNING)
                .orElse(false);
    }
}
