package com.pulseflow.pulseflow_backend.exception;

import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;

/** The graph itself is unusable: no start node, several start nodes, or edges pointing nowhere. */
public class WorkflowStructureException extends WorkflowExecutionException {

    public WorkflowStructureException(String message) {
        super(message, ErrorCategory.CONFIG, false, null);
    }
}
