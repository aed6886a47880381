package com.pulseflow.pulseflow_backend.model.domain;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED
}
