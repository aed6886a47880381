package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fails executions left RUNNING past the wall-clock budget, e.g. after a crash or restart.
 * A run still in flight sees the FAILED row through the cancellation probe and stops before its next node.
 */
@Slf4j
@Component
public class StaleExecutionSweeper {

    public static final String TIMEOUT_MESSAGE = "Execution timed out";

    private final ExecutionRepository executionRepository;
    private final Clock clock;
    private final Duration staleAfter;

    public StaleExecutionSweeper(ExecutionRepository executionRepository,
                                 Clock clock,
                                 @Value("${pulseflow.runs.stale-after-minutes:10}") long staleAfterMinutes) {
        this.executionRepository = executionRepository;
        this.clock = clock;
        this.staleAfter = Duration.ofMinutes(staleAfterMinutes);
    }

    @Scheduled(fixedDelayString = "${pulseflow.runs.stale-sweep-interval-ms:60000}")
    public void sweepOnSchedule() {
        sweep();
    }

    /** Returns how many executions were marked FAILED. */
    public int sweep() {
        Instant now = clock.instant();
        int cleared = executionRepository.failRunningStartedBefore(now.minus(staleAfter), TIMEOUT_MESSAGE, now);
        if (cleared > 0) {
            log.info("Marked {} stale execution(s) FAILED", cleared);
        }
        return cleared;
    }
}
