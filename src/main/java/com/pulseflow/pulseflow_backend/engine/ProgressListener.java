package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.model.event.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {

    void onEvent(ProgressEvent event);

    static ProgressListener noop() {
        return event -> { };
    }
}
