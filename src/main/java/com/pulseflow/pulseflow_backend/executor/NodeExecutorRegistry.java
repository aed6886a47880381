package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<NodeType, NodeExecutor> registry = new EnumMap<>(NodeType.class);

    /** Every dispatchable node type must have exactly one executor, or the application refuses to start. */
    @PostConstruct
    public void init() {
        for (NodeExecutor executor : executors) {
            NodeExecutor previous = registry.put(executor.supportedType(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors registered for " + executor.supportedType() + ": "
                        + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        Set<NodeType> missing = EnumSet.allOf(NodeType.class);
        missing.remove(NodeType.START);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No executor registered for node types: " + missing);
        }
        log.debug("Registered {} node executors", registry.size());
    }

    public NodeExecutor get(NodeType type) {
        NodeExecutor executor = registry.get(type);
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for node type: " + type);
        }
        return executor;
    }
}
