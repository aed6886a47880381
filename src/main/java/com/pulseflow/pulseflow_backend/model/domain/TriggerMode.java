package com.pulseflow.pulseflow_backend.model.domain;

public enum TriggerMode {
    MANUAL,
    SCHEDULE
}
