package com.pulseflow.pulseflow_backend.exception;

import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;
import lombok.Getter;

@Getter
public class AmountResolutionException extends WorkflowExecutionException {

    /** Config key of the amount that could not be resolved. */
    private final String field;

    public AmountResolutionException(String field, String message) {
        super(message, ErrorCategory.CONFIG, false, null);
        this.field = field;
    }

    public AmountResolutionException(String field, String message, Throwable cause) {
        super(message, ErrorCategory.CONFIG, false, cause);
        this.field = field;
    }
}
