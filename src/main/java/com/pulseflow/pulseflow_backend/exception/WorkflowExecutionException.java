package com.pulseflow.pulseflow_backend.exception;

import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;
import lombok.Getter;

/**
 * Base class for failures raised while running a workflow. Subclasses may pin a category so the
 * classifier does not have to guess from the message text.
 */
@Getter
public class WorkflowExecutionException extends RuntimeException {

    private final ErrorCategory categoryHint;
    private final boolean retryable;

    public WorkflowExecutionException(String message) {
        this(message, null, false, null);
    }

    public WorkflowExecutionException(String message, Throwable cause) {
        this(message, null, false, cause);
    }

    protected WorkflowExecutionException(String message, ErrorCategory categoryHint, boolean retryable, Throwable cause) {
        super(message, cause);
        this.categoryHint = categoryHint;
        this.retryable = retryable;
    }
}
