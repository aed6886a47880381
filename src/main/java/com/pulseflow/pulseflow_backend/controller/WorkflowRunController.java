package com.pulseflow.pulseflow_backend.controller;

import com.pulseflow.pulseflow_backend.model.domain.Execution;
import com.pulseflow.pulseflow_backend.service.WorkflowRunService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/automations")
@RequiredArgsConstructor
public class WorkflowRunController {

    private final WorkflowRunService runService;

    // POST /api/automations/{id}/run: returns the RUNNING execution; progress streams on /topic/execution/{executionId}
    @PostMapping("/{id}/run")
    public ResponseEntity<Execution> run(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(runService.triggerRun(id, "MANUAL"));
    }

    // POST /api/automations/{id}/stop: cancels the newest running execution
    @PostMapping("/{id}/stop")
    public ResponseEntity<Execution> stop(@PathVariable UUID id) {
        return ResponseEntity.ok(runService.stop(id));
    }
}
