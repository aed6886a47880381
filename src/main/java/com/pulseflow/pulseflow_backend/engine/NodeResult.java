package com.pulseflow.pulseflow_backend.engine;

import java.util.Map;

/** Output of one completed node in one loop pass. */
public record NodeResult(String nodeId, String nodeType, int iteration, Map<String, Object> output) {
}
