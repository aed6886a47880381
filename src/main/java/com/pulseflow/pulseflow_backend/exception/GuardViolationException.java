package com.pulseflow.pulseflow_backend.exception;

import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;

/** A guard node refused to let the run continue. The message is shown to the user as is. */
public class GuardViolationException extends WorkflowExecutionException {

    public GuardViolationException(String message) {
        super(message, ErrorCategory.BLOCKCHAIN, true, null);
    }
}
