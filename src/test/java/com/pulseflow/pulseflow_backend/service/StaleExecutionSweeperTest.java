package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StaleExecutionSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExecutionRepository executionRepository;

    @Test
    void runsOlderThanTenMinutesAreFailedWithTimeoutMessage() {
        StaleExecutionSweeper sweeper = new StaleExecutionSweeper(executionRepository, Clock.fixed(NOW, ZoneOffset.UTC), 10);
        when(executionRepository.failRunningStartedBefore(Instant.parse("2026-03-01T11:50:00Z"), "Execution timed out", NOW))
                .thenReturn(3);

        assertThat(sweeper.sweep()).isEqualTo(3);
    }

    @Test
    void scheduledSweepUsesConfiguredBudget() {
        StaleExecutionSweeper sweeper = new StaleExecutionSweeper(executionRepository, Clock.fixed(NOW, ZoneOffset.UTC), 30);

        sweeper.sweepOnSchedule();

        verify(executionRepository).failRunningStartedBefore(Instant.parse("2026-03-01T11:30:00Z"), "Execution timed out", NOW);
    }
}
