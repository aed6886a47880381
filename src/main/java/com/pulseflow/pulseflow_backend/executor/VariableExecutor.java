package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes VARIABLE nodes. Binds a resolved amount under a name that later nodes, and later loop passes,
 * can read with a { "type": "variable" } amount.
 *
 * Config: { "variableName": "budget", "value": { "type": "previousOutput", "field": "balance", "percentage": 10 } }
 */
@Component
@RequiredArgsConstructor
public class VariableExecutor implements NodeExecutor {

    private final AmountResolver amounts;

    @Override
    public NodeType supportedType() {
        return NodeType.VARIABLE;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String name = config.requireString("variableName", "Variable name");
        BigInteger value = amounts.resolve("value", config.asMap(), context, workflowId);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("value", value);
        return NodeOutcome.variable(output, name, value);
    }
}
