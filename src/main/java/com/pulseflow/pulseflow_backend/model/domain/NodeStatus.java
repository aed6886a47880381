package com.pulseflow.pulseflow_backend.model.domain;

public enum NodeStatus {
    RUNNING,
    SUCCESS,
    FAILURE,
    CANCELLED
}
