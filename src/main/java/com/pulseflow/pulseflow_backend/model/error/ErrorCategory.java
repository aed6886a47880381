package com.pulseflow.pulseflow_backend.model.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorCategory {
    NETWORK,
    BLOCKCHAIN,
    CONFIG,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
