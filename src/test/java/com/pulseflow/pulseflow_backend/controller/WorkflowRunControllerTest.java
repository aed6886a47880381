package com.pulseflow.pulseflow_backend.controller;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.service.WorkflowRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkflowRunControllerTest {

    private static final UUID WORKFLOW_ID = UUID.randomUUID();

    private WorkflowRunService runService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        runService = mock(WorkflowRunService.class);
        mvc = MockMvcBuilders.standaloneSetup(new WorkflowRunController(runService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void runIsAcceptedWithRunningExecution() throws Exception {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        execution.setWorkflowId(WORKFLOW_ID);
        execution.setTriggeredBy("MANUAL");
        when(runService.triggerRun(WORKFLOW_ID, "MANUAL")).thenReturn(execution);

        mvc.perform(post("/api/automations/{id}/run", WORKFLOW_ID))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.triggeredBy").value("MANUAL"));
    }

    @Test
    void runOfUnknownWorkflowIsNotFound() throws Exception {
        when(runService.triggerRun(WORKFLOW_ID, "MANUAL"))
                .thenThrow(new IllegalArgumentException("Workflow not found: " + WORKFLOW_ID));

        mvc.perform(post("/api/automations/{id}/run", WORKFLOW_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Workflow not found: " + WORKFLOW_ID));
    }

    @Test
    void stopReturnsCancelledExecution() throws Exception {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        execution.setWorkflowId(WORKFLOW_ID);
        execution.setStatus(ExecutionStatus.CANCELLED);
        when(runService.stop(WORKFLOW_ID)).thenReturn(execution);

        mvc.perform(post("/api/automations/{id}/stop", WORKFLOW_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void stopWithNothingRunningIsAConflict() throws Exception {
        when(runService.stop(WORKFLOW_ID))
                .thenThrow(new IllegalStateException("No running execution for workflow " + WORKFLOW_ID));

        mvc.perform(post("/api/automations/{id}/stop", WORKFLOW_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }
}
