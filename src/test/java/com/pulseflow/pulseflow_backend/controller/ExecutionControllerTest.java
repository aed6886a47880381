package com.pulseflow.pulseflow_backend.controller;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionLog;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.model.domain.NodeStatus;
import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;
import com.pulseflow.pulseflow_backend.repository.ExecutionLogRepository;
import com.pulseflow.pulseflow_backend.repository.ExecutionRepository;
import com.pulseflow.pulseflow_backend.service.StaleExecutionSweeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExecutionControllerTest {

    private static final UUID WORKFLOW_ID = UUID.randomUUID();
    private static final UUID EXECUTION_ID = UUID.randomUUID();

    private ExecutionRepository executionRepository;
    private ExecutionLogRepository logRepository;
    private StaleExecutionSweeper staleSweeper;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        executionRepository = mock(ExecutionRepository.class);
        logRepository = mock(ExecutionLogRepository.class);
        staleSweeper = mock(StaleExecutionSweeper.class);
        mvc = MockMvcBuilders.standaloneSetup(
                new ExecutionController(executionRepository, logRepository, staleSweeper)).build();
    }

    private static Execution failedExecution() {
        Execution execution = new Execution();
        execution.setId(EXECUTION_ID);
        execution.setWorkflowId(WORKFLOW_ID);
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setTriggeredBy("MANUAL");
        execution.setStartedAt(Instant.parse("2024-05-01T10:00:00Z"));
        execution.setCompletedAt(Instant.parse("2024-05-01T10:00:02.500Z"));
        execution.setError("Wallet has insufficient funds for this transaction.");
        execution.setErrorCategory(ErrorCategory.BLOCKCHAIN);
        execution.setErrorRetryable(false);
        execution.setFailedNodeId("swap-1");
        execution.setFailedNodeType("swap");
        return execution;
    }

    @Test
    void detailCarriesFailureAndDuration() throws Exception {
        when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(failedExecution()));

        mvc.perform(get("/api/executions/{id}", EXECUTION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.durationMs").value(2500))
                .andExpect(jsonPath("$.errorCategory").value("blockchain"))
                .andExpect(jsonPath("$.errorRetryable").value(false))
                .andExpect(jsonPath("$.failedNodeId").value("swap-1"));
    }

    @Test
    void unknownExecutionIsNotFound() throws Exception {
        when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.empty());

        mvc.perform(get("/api/executions/{id}", EXECUTION_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void historyListsRunsWithUnfinishedDurationAsMinusOne() throws Exception {
        Execution running = new Execution();
        running.setId(UUID.randomUUID());
        running.setWorkflowId(WORKFLOW_ID);
        when(executionRepository.findByWorkflowIdOrderByStartedAtDesc(WORKFLOW_ID))
                .thenReturn(List.of(running, failedExecution()));

        mvc.perform(get("/api/automations/{workflowId}/executions", WORKFLOW_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].status").value("RUNNING"))
                .andExpect(jsonPath("$[0].durationMs").value(-1))
                .andExpect(jsonPath("$[1].error").value("Wallet has insufficient funds for this transaction."));
    }

    @Test
    void logsOfUnknownExecutionAreNotFound() throws Exception {
        when(executionRepository.existsById(EXECUTION_ID)).thenReturn(false);

        mvc.perform(get("/api/executions/{id}/logs", EXECUTION_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void logsAreReturnedInStartOrder() throws Exception {
        ExecutionLog first = new ExecutionLog();
        first.setExecutionId(EXECUTION_ID);
        first.setNodeId("bal");
        first.setStatus(NodeStatus.SUCCESS);
        ExecutionLog second = new ExecutionLog();
        second.setExecutionId(EXECUTION_ID);
        second.setNodeId("swap-1");
        second.setStatus(NodeStatus.FAILURE);
        when(executionRepository.existsById(EXECUTION_ID)).thenReturn(true);
        when(logRepository.findByExecutionIdOrderByStartedAtAsc(EXECUTION_ID)).thenReturn(List.of(first, second));

        mvc.perform(get("/api/executions/{id}/logs", EXECUTION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nodeId").value("bal"))
                .andExpect(jsonPath("$[1].status").value("FAILURE"));
    }

    @Test
    void clearStaleReportsHowManyRunsWereFailed() throws Exception {
        when(staleSweeper.sweep()).thenReturn(2);

        mvc.perform(post("/api/executions/clear-stale"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(2));
    }
}
