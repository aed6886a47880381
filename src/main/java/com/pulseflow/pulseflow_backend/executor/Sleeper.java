package com.pulseflow.pulseflow_backend.executor;

import java.time.Duration;

/** Blocks the calling thread. Swapped for a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
