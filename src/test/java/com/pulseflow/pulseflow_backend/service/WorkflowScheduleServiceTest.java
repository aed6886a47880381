package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.exception.InvalidScheduleException;
import com.pulseflow.pulseflow_backend.model.domain.TriggerMode;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import com.pulseflow.pulseflow_backend.repository.WorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private WorkflowRepository workflowRepository;
    @Mock private WorkflowRunService runService;

    private WorkflowScheduleService service;

    @BeforeEach
    void setUp() {
        service = new WorkflowScheduleService(workflowRepository, runService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Workflow scheduled(String cron, Instant nextRunAt) {
        Workflow workflow = new Workflow();
        workflow.setId(UUID.randomUUID());
        workflow.setTriggerMode(TriggerMode.SCHEDULE);
        workflow.setCronExpression(cron);
        workflow.setNextRunAt(nextRunAt);
        return workflow;
    }

    private void due(Workflow... workflows) {
        when(workflowRepository.findByTriggerModeAndNextRunAtLessThanEqual(TriggerMode.SCHEDULE, NOW))
                .thenReturn(List.of(workflows));
    }

    @Test
    void dueWorkflowIsStartedAndRescheduled() {
        Workflow hourly = scheduled("0 * * * *", NOW);
        due(hourly);

        service.runDueWorkflows();

        verify(runService).triggerRun(hourly.getId(), "SCHEDULED");
        assertThat(hourly.getLastRunAt()).isEqualTo(NOW);
        assertThat(hourly.getNextRunAt()).isEqualTo(Instant.parse("2026-03-01T13:00:00Z"));
        verify(workflowRepository).save(hourly);
    }

    @Test
    void failedStartStillMovesNextRunForward() {
        Workflow empty = scheduled("0 */6 * * *", NOW.minusSeconds(30));
        Workflow healthy = scheduled("0 0 * * *", NOW);
        due(empty, healthy);
        when(runService.triggerRun(empty.getId(), "SCHEDULED"))
                .thenThrow(new IllegalStateException("Workflow " + empty.getId() + " has no nodes"));

        service.runDueWorkflows();

        assertThat(empty.getNextRunAt()).isEqualTo(Instant.parse("2026-03-01T18:00:00Z"));
        assertThat(empty.getLastRunAt()).isEqualTo(NOW);
        verify(runService).triggerRun(healthy.getId(), "SCHEDULED");
    }

    @Test
    void scheduleBelowMinimumIntervalIsDisabledNotRun() {
        Workflow tooFast = scheduled("*/5 * * * *", NOW);
        due(tooFast);

        service.runDueWorkflows();

        verify(runService, never()).triggerRun(any(), any());
        assertThat(tooFast.getNextRunAt()).isNull();
        assertThat(tooFast.getLastRunAt()).isNull();
        verify(workflowRepository).save(tooFast);
    }

    @Test
    void nothingDueDoesNothing() {
        due();

        service.runDueWorkflows();

        verify(runService, never()).triggerRun(any(), any());
        verify(workflowRepository, never()).save(any());
    }

    @Test
    void enablingScheduleComputesFirstRun() {
        Workflow workflow = new Workflow();
        workflow.setId(UUID.randomUUID());
        when(workflowRepository.findById(workflow.getId())).thenReturn(Optional.of(workflow));
        when(workflowRepository.save(workflow)).thenReturn(workflow);

        Workflow saved = service.updateSchedule(workflow.getId(), TriggerMode.SCHEDULE, " 0 */2 * * * ");

        assertThat(saved.getTriggerMode()).isEqualTo(TriggerMode.SCHEDULE);
        assertThat(saved.getCronExpression()).isEqualTo("0 */2 * * *");
        assertThat(saved.getNextRunAt()).isEqualTo(Instant.parse("2026-03-01T14:00:00Z"));
    }

    @Test
    void switchingBackToManualClearsNextRun() {
        Workflow workflow = scheduled("0 * * * *", NOW.plusSeconds(600));
        when(workflowRepository.findById(workflow.getId())).thenReturn(Optional.of(workflow));
        when(workflowRepository.save(workflow)).thenReturn(workflow);

        Workflow saved = service.updateSchedule(workflow.getId(), TriggerMode.MANUAL, null);

        assertThat(saved.getTriggerMode()).isEqualTo(TriggerMode.MANUAL);
        assertThat(saved.getNextRunAt()).isNull();
    }

    @Test
    void invalidScheduleIsRejectedWithoutSaving() {
        Workflow workflow = new Workflow();
        workflow.setId(UUID.randomUUID());
        when(workflowRepository.findById(workflow.getId())).thenReturn(Optional.of(workflow));

        assertThatThrownBy(() -> service.updateSchedule(workflow.getId(), TriggerMode.SCHEDULE, "*/10 * * * *"))
                .isInstanceOf(InvalidScheduleException.class);
        verify(workflowRepository, never()).save(any());
        assertThat(workflow.getTriggerMode()).isEqualTo(TriggerMode.MANUAL);
    }
}
