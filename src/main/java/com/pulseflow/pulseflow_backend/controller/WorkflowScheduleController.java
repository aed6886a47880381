package com.pulseflow.pulseflow_backend.controller;

import com.pulseflow.pulseflow_backend.model.domain.TriggerMode;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import com.pulseflow.pulseflow_backend.service.WorkflowScheduleService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/automations")
@RequiredArgsConstructor
public class WorkflowScheduleController {

    private final WorkflowScheduleService scheduleService;

    // PUT /api/automations/{id}/schedule: {"triggerMode":"SCHEDULE","cronExpression":"0 */2 * * *"}
    @PutMapping("/{id}/schedule")
    public ScheduleView updateSchedule(@PathVariable UUID id, @RequestBody ScheduleRequest request) {
        Workflow workflow = scheduleService.updateSchedule(id, request.triggerMode(), request.cronExpression());
        return new ScheduleView(workflow.getTriggerMode(), workflow.getCronExpression(),
                workflow.getNextRunAt(), workflow.getLastRunAt());
    }

    public record ScheduleRequest(TriggerMode triggerMode, String cronExpression) {}

    public record ScheduleView(TriggerMode triggerMode, String cronExpression, Instant nextRunAt, Instant lastRunAt) {}
}
