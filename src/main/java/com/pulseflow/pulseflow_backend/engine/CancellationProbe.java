package com.pulseflow.pulseflow_backend.engine;

/**
 * Answers whether a stop was requested for a run. Polled by the engine before every node.
 */
@FunctionalInterface
public interface CancellationProbe {

    boolean isCancelled(String executionId);
}
