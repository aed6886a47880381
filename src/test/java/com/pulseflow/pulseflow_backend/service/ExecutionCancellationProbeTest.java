package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionCancellationProbeTest {

    private static final UUID EXECUTION_ID = UUID.randomUUID();

    @Mock
    private ExecutionRepository executionRepository;

    @InjectMocks
    private ExecutionCancellationProbe probe;

    private void stored(ExecutionStatus status) {
        Execution execution = new Execution();
        execution.setId(EXECUTION_ID);
        execution.setStatus(status);
        when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(execution));
    }

    @Test
    void cancelledExecutionIsReportedCancelled() {
        stored(ExecutionStatus.CANCELLED);

        assertThat(probe.isCancelled(EXECUTION_ID.toString())).isTrue();
    }

    @Test
    void runningExecutionIsNotCancelled() {
        stored(ExecutionStatus.RUNNING);

        assertThat(probe.isCancelled(EXECUTION_ID.toString())).isFalse();
    }

    @Test
    void timedOutExecutionStopsTheRun() {
        stored(ExecutionStatus.FAILED);

        assertThat(probe.isCancelled(EXECUTION_ID.toString())).isTrue();
    }

    @Test
    void missingExecutionIsNotCancelled() {
        when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.empty());

        assertThat(probe.isCancelled(EXECUTION_ID.toString())).isFalse();
    }
}
