package com.pulseflow.pulseflow_backend.executor;

import java.math.BigInteger;
import java.util.Map;

/**
 * What a node produced. Besides the output record, control nodes report the branch they selected or the
 * pass count they declared, and variable nodes the binding to add to the context.
 */
public record NodeOutcome(
        Map<String, Object> output,
        String branch,
        Integer loopCount,
        String variableName,
        BigInteger variableValue
) {

    public static NodeOutcome of(Map<String, Object> output) {
        return new NodeOutcome(output, null, null, null, null);
    }

    public static NodeOutcome branch(Map<String, Object> output, String branch) {
        return new NodeOutcome(output, branch, null, null, null);
    }

    public static NodeOutcome loop(Map<String, Object> output, int loopCount) {
        return new NodeOutcome(output, null, loopCount, null, null);
    }

    public static NodeOutcome variable(Map<String, Object> output, String name, BigInteger value) {
        return new NodeOutcome(output, null, null, name, value);
    }
}
