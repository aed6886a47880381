package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.exception.WorkflowExecutionException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pauses the run. Config: { "delay": 5 } in seconds, clamped to [1, 10].
 */
@Slf4j
@Component
@RequiredArgsConstructor
class WaitExecutor implements NodeExecutor {

    static final int MIN_DELAY_SECONDS = 1;
    static final int MAX_DELAY_SECONDS = 10;

    private final Sleeper sleeper;

    @Override
    public NodeType supportedType() {
        return NodeType.WAIT;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        int requested = NodeConfig.of(node.getConfig()).integer("delay", MAX_DELAY_SECONDS);
        int delay = Math.max(MIN_DELAY_SECONDS, Math.min(MAX_DELAY_SECONDS, requested));

        log.debug("Waiting {}s in node {}", delay, node.getNodeId());
        try {
            sleeper.sleep(Duration.ofSeconds(delay));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowExecutionException("Wait interrupted", e);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("delay", delay);
        return NodeOutcome.of(output);
    }
}
