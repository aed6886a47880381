package com.pulseflow.pulseflow_backend.controller;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionLog;
import com.pulseflow.pulseflow_backend.repository.ExecutionLogRepository;
import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import com.pulseflow.pulseflow_backend.service.StaleExecutionSweeper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionRepository    executionRepository;
    private final ExecutionLogRepository logRepository;
    private final StaleExecutionSweeper  staleSweeper;

    // GET /api/automations/{id}/executions: run history of one workflow, newest first
    @GetMapping("/api/automations/{workflowId}/executions")
    public List<ExecutionSummary> listForWorkflow(@PathVariable UUID workflowId) {
        return executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId).stream()
                .map(this::toSummary)
                .toList();
    }

    // GET /api/executions/{id}: full detail including the result snapshot
    @GetMapping("/api/executions/{id}")
    public ResponseEntity<ExecutionDetail> getById(@PathVariable UUID id) {
        return executionRepository.findById(id)
                .map(e -> ResponseEntity.ok(toDetail(e)))
                .orElse(ResponseEntity.notFound().build());
    }

    // GET /api/executions/{id}/logs: one row per node run, in start order
    @GetMapping("/api/executions/{id}/logs")
    public ResponseEntity<List<ExecutionLog>> getLogs(@PathVariable UUID id) {
        if (!executionRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(logRepository.findByExecutionIdOrderByStartedAtAsc(id));
    }

    // POST /api/executions/clear-stale: fails runs stuck in RUNNING past the timeout right away
    @PostMapping("/api/executions/clear-stale")
    public Map<String, Integer> clearStale() {
        return Map.of("cleared", staleSweeper.sweep());
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private ExecutionSummary toSummary(Execution e) {
        return new ExecutionSummary(
                e.getId().toString(),
                e.getWorkflowId().toString(),
                e.getStatus().name(),
                e.getTriggeredBy(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                e.getCompletedAt() != null ? e.getCompletedAt().toString() : null,
                durationMs(e),
                e.getError()
        );
    }

    private ExecutionDetail toDetail(Execution e) {
        return new ExecutionDetail(
                e.getId().toString(),
                e.getWorkflowId().toString(),
                e.getStatus().name(),
                e.getTriggeredBy(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                e.getCompletedAt() != null ? e.getCompletedAt().toString() : null,
                durationMs(e),
                e.getError(),
                e.getErrorCategory() != null ? e.getErrorCategory().wireName() : null,
                e.getErrorRetryable(),
                e.getErrorDetail(),
                e.getFailedNodeId(),
                e.getFailedNodeType(),
                e.getResultSnapshot()
        );
    }

    private static long durationMs(Execution e) {
        return (e.getCompletedAt() != null && e.getStartedAt() != null)
                ? Duration.between(e.getStartedAt(), e.getCompletedAt()).toMillis()
                : -1;
    }

    public record ExecutionSummary(
            String id,
            String workflowId,
            String status,
            String triggeredBy,
            String startedAt,
            String completedAt,
            long   durationMs,
            String error
    ) {}

    public record ExecutionDetail(
            String              id,
            String              workflowId,
            String              status,
            String              triggeredBy,
            String              startedAt,
            String              completedAt,
            long                durationMs,
            String              error,
            String              errorCategory,
            Boolean             errorRetryable,
            String              errorDetail,
            String              failedNodeId,
            String              failedNodeType,
            Map<String, Object> resultSnapshot  // ordered node results and final variables
    ) {}
}
