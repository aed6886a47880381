package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes LOOP nodes. Performs nothing itself; it declares how many times the whole chain runs and the
 * engine restarts from the start node until that many passes are done.
 *
 * Config: { "loopCount": 3 }
 */
@Component
public class LoopExecutor implements NodeExecutor {

    public static final int MIN_LOOPS = 1;
    public static final int MAX_LOOPS = 3;

    @Override
    public NodeType supportedType() {
        return NodeType.LOOP;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        int loopCount = clamp(NodeConfig.of(node.getConfig()).integer("loopCount", MIN_LOOPS));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("loopCount", loopCount);
        output.put("currentIteration", context.getCurrentIteration());
        return NodeOutcome.loop(output, loopCount);
    }

    public static int clamp(int loopCount) {
        return Math.max(MIN_LOOPS, Math.min(MAX_LOOPS, loopCount));
    }
}
