package com.pulseflow.pulseflow_backend.model.context;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run state threaded from node to node. Instances are never mutated: every update returns a new
 * context, so an abandoned branch or a finished loop pass cannot leak outputs into later nodes.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionContext {

    @Builder.Default
    Map<String, Map<String, Object>> nodeOutputs = Map.of();

    String previousNodeId;

    String previousNodeType;

    @Builder.Default
    Map<String, BigInteger> variables = Map.of();

    int currentIteration;

    public static ExecutionContext create() {
        return ExecutionContext.builder().build();
    }

    /** Records {@code output} for the node and makes it the previous node. A null output only moves the pointer. */
    public ExecutionContext withOutput(String nodeId, String nodeType, Map<String, Object> output) {
        ExecutionContextBuilder next = toBuilder()
                .previousNodeId(nodeId)
                .previousNodeType(nodeType);
        if (output != null) {
            Map<String, Map<String, Object>> outputs = new LinkedHashMap<>(nodeOutputs);
            outputs.put(nodeId, Collections.unmodifiableMap(new LinkedHashMap<>(output)));
            next.nodeOutputs(Collections.unmodifiableMap(outputs));
        }
        return next.build();
    }

    public ExecutionContext withVariable(String name, BigInteger value) {
        Map<String, BigInteger> vars = new LinkedHashMap<>(variables);
        vars.put(name, value);
        return toBuilder().variables(Collections.unmodifiableMap(vars)).build();
    }

    /**
     * Starts loop pass {@code iteration} (zero-based). Node outputs and the previous-node pointer are
     * cleared; variables survive across passes.
     */
    public ExecutionContext startIteration(int iteration) {
        return toBuilder()
                .nodeOutputs(Map.of())
                .previousNodeId(null)
                .previousNodeType(null)
                .currentIteration(iteration)
                .build();
    }

    public Optional<Map<String, Object>> previousOutput() {
        return previousNodeId == null ? Optional.empty() : Optional.ofNullable(nodeOutputs.get(previousNodeId));
    }

    public Optional<BigInteger> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }
}
