package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one node through its executor and threads the result into a new context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeDispatcher {

    private final NodeExecutorRegistry executorRegistry;

    public DispatchResult dispatch(WorkflowNode node, ExecutionContext context, String workflowId) {
        log.debug("Dispatching node {} ({}) for workflow {}", node.getNodeId(), node.getNodeType(), workflowId);
        NodeOutcome outcome = executorRegistry.get(node.getNodeType()).execute(node, context, workflowId);

        ExecutionContext next = context;
        if (outcome.variableName() != null) {
            next = next.withVariable(outcome.variableName(), outcome.variableValue());
        }
        next = next.withOutput(node.getNodeId(), node.getNodeType().getWireName(), outcome.output());
        return new DispatchResult(outcome, next);
    }

    public record DispatchResult(NodeOutcome outcome, ExecutionContext context) {}
}
