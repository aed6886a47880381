package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.model.domain.WorkflowEdge;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;

import java.util.List;

/** Read-only view of a workflow definition, as loaded from the store. */
public record WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {

    public WorkflowGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
