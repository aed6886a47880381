package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.model.event.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ExecutionEventPublisher {

    // The dashboard subscribes to /topic/execution/{executionId} to receive live updates
    public static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void publish(String executionId, ProgressEvent event) {
        String destination = TOPIC + executionId;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing {} for node {} to {} via {}", event.getClass().getSimpleName(), event.nodeId(),
                destination, bridge != null ? "Redis" : "direct");
        if (bridge != null) {
            bridge.publish(destination, event);
        } else {
            messagingTemplate.convertAndSend(destination, event);
        }
    }
}
