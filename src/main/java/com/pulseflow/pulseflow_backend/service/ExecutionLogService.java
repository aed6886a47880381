package com.pulseflow.pulseflow_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulseflow.pulseflow_backend.engine.ExecutionEventPublisher;
import com.pulseflow.pulseflow_backend.engine.ProgressListener;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionLog;
import com.pulseflow.pulseflow_backend.model.domain.NodeStatus;
import com.pulseflow.pulseflow_backend.model.event.ProgressEvent;
import com.pulseflow.pulseflow_backend.repository.ExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Sink for a run's progress events: keeps one {@link ExecutionLog} row per node run and streams every event
 * to the dashboard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ExecutionLogRepository logRepository;
    private final ExecutionEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public ProgressListener listenerFor(UUID executionId) {
        return event -> record(executionId, event);
    }

    public void record(UUID executionId, ProgressEvent event) {
        if (event instanceof ProgressEvent.NodeStart start) {
            ExecutionLog row = newRow(executionId, start, NodeStatus.RUNNING);
            logRepository.save(row);
        } else if (event instanceof ProgressEvent.NodeComplete complete) {
            ExecutionLog row = runningRow(executionId, complete);
            row.setStatus(NodeStatus.SUCCESS);
            row.setOutputSnapshot(snapshot(complete.output()));
            row.setCompletedAt(Instant.now());
            logRepository.save(row);
        } else if (event instanceof ProgressEvent.NodeError error) {
            ExecutionLog row = runningRow(executionId, error);
            row.setStatus(NodeStatus.FAILURE);
            row.setErrorMessage(error.error());
            row.setCompletedAt(Instant.now());
            logRepository.save(row);
        } else if (event instanceof ProgressEvent.BranchTaken branch) {
            logRepository.findFirstByExecutionIdAndNodeIdAndStatusOrderByStartedAtDesc(
                    executionId, branch.nodeId(), NodeStatus.SUCCESS).ifPresent(row -> {
                Map<String, Object> output = row.getOutputSnapshot() != null
                        ? new LinkedHashMap<>(row.getOutputSnapshot())
                        : new LinkedHashMap<>();
                output.put("nextNodeIds", branch.targetNodeIds());
                row.setOutputSnapshot(output);
                logRepository.save(row);
            });
        } else if (event instanceof ProgressEvent.Cancelled cancelled) {
            ExecutionLog row = newRow(executionId, cancelled, NodeStatus.CANCELLED);
            row.setCompletedAt(row.getStartedAt());
            logRepository.save(row);
        }
        eventPublisher.publish(executionId.toString(), event);
    }

    private ExecutionLog newRow(UUID executionId, ProgressEvent event, NodeStatus status) {
        ExecutionLog row = new ExecutionLog();
        row.setExecutionId(executionId);
        row.setNodeId(event.nodeId());
        row.setNodeType(event.nodeType());
        row.setIteration(event.iteration());
        row.setStatus(status);
        row.setStartedAt(Instant.now());
        return row;
    }

    // The start row is normally there; if its save was lost, the completion still gets its own row
    private ExecutionLog runningRow(UUID executionId, ProgressEvent event) {
        return logRepository.findFirstByExecutionIdAndNodeIdAndStatusOrderByStartedAtDesc(
                        executionId, event.nodeId(), NodeStatus.RUNNING)
                .orElseGet(() -> {
                    log.warn("No RUNNING log row for node {} in execution {}", event.nodeId(), executionId);
                    return newRow(executionId, event, NodeStatus.RUNNING);
                });
    }

    // Round trip through the application mapper so BigInteger amounts are stored as strings
    private Map<String, Object> snapshot(Map<String, Object> output) {
        return output != null ? objectMapper.convertValue(output, MAP_TYPE) : null;
    }
}
