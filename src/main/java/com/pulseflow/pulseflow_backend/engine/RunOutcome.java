package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.ExecutionStatus;
import com.pulseflow.pulseflow_backend.model.error.ParsedError;

import java.util.List;

/**
 * Terminal state of a run. Results are in dispatch order, across loop passes.
 */
public sealed interface RunOutcome {

    List<NodeResult> results();

    ExecutionStatus status();

    record Success(List<NodeResult> results, ExecutionContext context) implements RunOutcome {
        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.SUCCESS;
        }
    }

    /** {@code failedNodeId} is null when the graph was rejected before any node ran. */
    record Failed(ParsedError error, String failedNodeId, String failedNodeType,
                  List<NodeResult> results) implements RunOutcome {
        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.FAILED;
        }
    }

    /** {@code nextNodeId} is the node that was about to start when the stop was observed. */
    record Cancelled(List<NodeResult> results, String nextNodeId) implements RunOutcome {
        @Override
        public ExecutionStatus status() {
            return ExecutionStatus.CANCELLED;
        }
    }
}
