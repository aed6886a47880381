package com.pulseflow.pulseflow_backend.model.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;

import java.util.List;
import java.util.Map;

/**
 * Live progress of a run. Emitted by the engine to its caller, never stored by the engine itself.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProgressEvent.NodeStart.class,    name = "node_start"),
        @JsonSubTypes.Type(value = ProgressEvent.NodeComplete.class, name = "node_complete"),
        @JsonSubTypes.Type(value = ProgressEvent.NodeError.class,    name = "node_error"),
        @JsonSubTypes.Type(value = ProgressEvent.BranchTaken.class,  name = "branch_taken"),
        @JsonSubTypes.Type(value = ProgressEvent.Cancelled.class,    name = "cancelled")
})
public sealed interface ProgressEvent {

    String nodeId();

    String nodeType();

    int iteration();

    record NodeStart(String nodeId, String nodeType, int iteration) implements ProgressEvent {}

    record NodeComplete(String nodeId, String nodeType, int iteration, Map<String, Object> output) implements ProgressEvent {}

    record NodeError(String nodeId, String nodeType, int iteration,
                     String error, ErrorCategory category, boolean retryable) implements ProgressEvent {}

    /** An empty {@code targetNodeIds} means the selected branch has no edge and the path ends here. */
    record BranchTaken(String nodeId, String nodeType, int iteration,
                       String branch, List<String> targetNodeIds) implements ProgressEvent {}

    /** Carries the node that would have run next. */
    record Cancelled(String nodeId, String nodeType, int iteration) implements ProgressEvent {}
}
