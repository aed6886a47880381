package com.pulseflow.pulseflow_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulseflow.pulseflow_backend.engine.ErrorClassifier;
import com.pulseflow.pulseflow_backend.engine.RunOutcome;
import com.pulseflow.pulseflow_backend.engine.WorkflowExecutionEngine;
import com.pulseflow.pulseflow_backend.engine.WorkflowGraph;
import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowEdge;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import com.pulseflow.pulseflow_backend.model.error.ParsedError;
import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import com.pulseflow.pulseflow_backend.repository.WorkflowEdgeRepository;
import com.pulseflow.pulseflow_backend.repository.WorkflowNodeRepository;
import com.pulseflow.pulseflow_backend.repository.WorkflowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class WorkflowRunService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    static final String RUN_QUEUE_FULL = "Too many runs in progress, try again shortly";

    private final WorkflowExecutionEngine engine;
    private final WorkflowRepository workflowRepository;
    private final WorkflowNodeRepository nodeRepository;
    private final WorkflowEdgeRepository edgeRepository;
    private final ExecutionRepository executionRepository;
    private final ExecutionLogService logService;
    private final ErrorClassifier errorClassifier;
    private final ObjectMapper objectMapper;
    private final Executor runExecutor;

    public WorkflowRunService(WorkflowExecutionEngine engine,
                              WorkflowRepository workflowRepository,
                              WorkflowNodeRepository nodeRepository,
                              WorkflowEdgeRepository edgeRepository,
                              ExecutionRepository executionRepository,
                              ExecutionLogService logService,
                              ErrorClassifier errorClassifier,
                              ObjectMapper objectMapper,
                              @Qualifier("workflowRunExecutor") Executor runExecutor) {
        this.engine = engine;
        this.workflowRepository = workflowRepository;
        this.nodeRepository = nodeRepository;
        this.edgeRepository = edgeRepository;
        this.executionRepository = executionRepository;
        this.logService = logService;
        this.errorClassifier = errorClassifier;
        this.objectMapper = objectMapper;
        this.runExecutor = runExecutor;
    }

    /**
     * Starts a run and returns immediately with the execution (status RUNNING).
     * The engine runs in the background so the dashboard can subscribe to
     * /topic/execution/{id} before the first node event is sent.
     */
    public Execution triggerRun(UUID workflowId, String triggeredBy) {
        workflowRepository.findById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
        List<WorkflowNode> nodes = nodeRepository.findByWorkflowId(workflowId);
        if (nodes.isEmpty()) {
            throw new IllegalStateException("Workflow " + workflowId + " has no nodes");
        }
        List<WorkflowEdge> edges = edgeRepository.findByWorkflowId(workflowId);

        Execution execution = new Execution();
        execution.setWorkflowId(workflowId);
        execution.setTriggeredBy(triggeredBy);
        execution = executionRepository.save(execution);

        final UUID executionId = execution.getId();
        WorkflowGraph graph = new WorkflowGraph(nodes, edges);
        try {
            CompletableFuture.runAsync(() -> runInBackground(executionId, workflowId, graph), runExecutor)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            log.error("Background run of execution {} ended abnormally", executionId, ex);
                        }
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Run queue is full, rejecting execution {} of workflow {}", executionId, workflowId);
            execution.setStatus(ExecutionStatus.FAILED);
            execution.setError(RUN_QUEUE_FULL);
            execution.setCompletedAt(Instant.now());
            executionRepository.save(execution);
            throw new IllegalStateException(RUN_QUEUE_FULL, e);
        }
        return execution;
    }

    /** Marks the newest running execution of the workflow CANCELLED; the engine stops before its next node. */
    public Execution stop(UUID workflowId) {
        Execution execution = executionRepository
                .findFirstByWorkflowIdAndStatusOrderByStartedAtDesc(workflowId, ExecutionStatus.RUNNING)
                .orElseThrow(() -> new IllegalStateException("No running execution for workflow " + workflowId));
        int changed = executionRepository.transitionStatus(
                execution.getId(), ExecutionStatus.RUNNING, ExecutionStatus.CANCELLED);
        if (changed == 0) {
            throw new IllegalStateException("Execution " + execution.getId() + " finished before it could be stopped");
        }
        log.info("Stop requested for execution {} of workflow {}", execution.getId(), workflowId);
        execution.setStatus(ExecutionStatus.CANCELLED);
        return execution;
    }

    void runInBackground(UUID executionId, UUID workflowId, WorkflowGraph graph) {
        RunOutcome outcome;
        try {
            outcome = engine.run(workflowId.toString(), executionId.toString(), graph, logService.listenerFor(executionId));
        } catch (Exception ex) {
            log.error("Execution {} of workflow {} crashed", executionId, workflowId, ex);
            outcome = new RunOutcome.Failed(errorClassifier.classify(ex), null, null, List.of());
        }

        try {
            finish(executionId, outcome);
        } catch (OptimisticLockingFailureException e) {
            // A stop or timeout landed between the re-read and the save; re-read once and keep its status
            log.info("Execution {} changed while finishing, retrying", executionId);
            finishAfterConflict(executionId, outcome);
        } catch (RuntimeException e) {
            log.error("Could not record the outcome of execution {}", executionId, e);
            markFinishFailed(executionId, e);
        }
    }

    private void finishAfterConflict(UUID executionId, RunOutcome outcome) {
        try {
            finish(executionId, outcome);
        } catch (RuntimeException e) {
            log.error("Could not record the outcome of execution {} after a concurrent update", executionId, e);
            markFinishFailed(executionId, e);
        }
    }

    private void finish(UUID executionId, RunOutcome outcome) {
        Execution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Execution not found: " + executionId));
        // Only a run still RUNNING takes the engine's status; CANCELLED and timed-out rows keep theirs
        if (execution.getStatus() == ExecutionStatus.RUNNING) {
            execution.setStatus(outcome.status());
            if (outcome instanceof RunOutcome.Failed failed) {
                ParsedError error = failed.error();
                execution.setError(error.userMessage());
                execution.setErrorCategory(error.category());
                execution.setErrorRetryable(error.retryable());
                execution.setErrorDetail(truncate(error.technicalDetails(), 4000));
                execution.setFailedNodeId(failed.failedNodeId());
                execution.setFailedNodeType(failed.failedNodeType());
            }
        }
        execution.setResultSnapshot(snapshot(outcome));
        if (execution.getCompletedAt() == null) {
            execution.setCompletedAt(Instant.now());
        }
        executionRepository.save(execution);
    }

    // Last resort so the row never stays RUNNING; only the status columns are touched
    private void markFinishFailed(UUID executionId, RuntimeException cause) {
        try {
            int changed = executionRepository.transitionStatus(executionId, ExecutionStatus.RUNNING, ExecutionStatus.FAILED);
            log.warn("Execution {} marked FAILED after finish error ({} row(s)): {}", executionId, changed, cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Execution {} could not be marked FAILED; the stale-run sweeper will time it out", executionId, e);
        }
    }

    private Map<String, Object> snapshot(RunOutcome outcome) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", outcome.status());
        snapshot.put("results", outcome.results());
        if (outcome instanceof RunOutcome.Success success) {
            snapshot.put("variables", success.context().getVariables());
            snapshot.put("iterations", success.context().getCurrentIteration() + 1);
        } else if (outcome instanceof RunOutcome.Cancelled cancelled) {
            snapshot.put("cancelledBeforeNodeId", cancelled.nextNodeId());
        }
        return objectMapper.convertValue(snapshot, MAP_TYPE);
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
