package com.pulseflow.pulseflow_backend.exception;

import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;

public class NodeConfigurationException extends WorkflowExecutionException {

    public NodeConfigurationException(String message) {
        super(message, ErrorCategory.CONFIG, false, null);
    }
}
