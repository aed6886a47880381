package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;

public interface NodeExecutor {

    NodeType supportedType();

    // Runs the node against the chain; reads the context but never changes it, the dispatcher does that
    NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId);
}
