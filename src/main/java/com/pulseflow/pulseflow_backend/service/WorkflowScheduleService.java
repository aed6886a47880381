package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.exception.InvalidScheduleException;
import com.pulseflow.pulseflow_backend.model.domain.TriggerMode;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import com.pulseflow.pulseflow_backend.repository.WorkflowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Cron-triggered runs. A workflow in SCHEDULE mode carries a five-field cron expression and the
 * instant of its next run; the poller starts every due workflow and moves nextRunAt forward,
 * whether or not the run could be started.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowScheduleService {

    static final String TRIGGERED_BY = "SCHEDULED";

    private final WorkflowRepository workflowRepository;
    private final WorkflowRunService runService;
    private final Clock clock;

    public Workflow updateSchedule(UUID workflowId, TriggerMode triggerMode, String cronExpression) {
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
        if (triggerMode == TriggerMode.SCHEDULE) {
            Instant now = clock.instant();
            CronSchedule schedule = CronSchedule.parseWithMinimumInterval(cronExpression, now);
            workflow.setCronExpression(schedule.expression());
            workflow.setNextRunAt(schedule.nextRunAfter(now));
        } else {
            workflow.setNextRunAt(null);
        }
        workflow.setTriggerMode(triggerMode == null ? TriggerMode.MANUAL : triggerMode);
        log.info("Workflow {} set to {} (next run {})", workflowId, workflow.getTriggerMode(), workflow.getNextRunAt());
        return workflowRepository.save(workflow);
    }

    @Scheduled(fixedDelayString = "${pulseflow.scheduler.poll-interval-ms:60000}",
               initialDelayString = "${pulseflow.scheduler.initial-delay-ms:30000}")
    public void runDueWorkflows() {
        Instant now = clock.instant();
        List<Workflow> due = workflowRepository.findByTriggerModeAndNextRunAtLessThanEqual(TriggerMode.SCHEDULE, now);
        if (due.isEmpty()) {
            return;
        }
        log.info("Found {} scheduled workflow(s) due to run", due.size());
        int started = 0;
        for (Workflow workflow : due) {
            if (runScheduled(workflow, now)) {
                started++;
            }
        }
        log.info("Started {}/{} scheduled workflow(s)", started, due.size());
    }

    private boolean runScheduled(Workflow workflow, Instant now) {
        CronSchedule schedule;
        try {
            schedule = CronSchedule.parseWithMinimumInterval(workflow.getCronExpression(), now);
        } catch (InvalidScheduleException e) {
            log.warn("Disabling schedule of workflow {}: {}", workflow.getId(), e.getMessage());
            workflow.setNextRunAt(null);
            workflowRepository.save(workflow);
            return false;
        }

        boolean started = false;
        try {
            runService.triggerRun(workflow.getId(), TRIGGERED_BY);
            started = true;
        } catch (RuntimeException e) {
            log.warn("Scheduled run of workflow {} was not started: {}", workflow.getId(), e.getMessage());
        }
        workflow.setLastRunAt(now);
        workflow.setNextRunAt(schedule.nextRunAfter(now));
        workflowRepository.save(workflow);
        return started;
    }
}
