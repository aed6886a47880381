package com.pulseflow.pulseflow_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisWebSocketBridgeTest {

    private static final String CHANNEL = "pulseflow:test:progress";

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private SimpMessagingTemplate messagingTemplate;
    @Mock private Message message;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisWebSocketBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper, CHANNEL);
    }

    @Test
    void publishesOnConfiguredChannel() throws Exception {
        bridge.publish("/topic/execution/e1", Map.of("nodeId", "swap-1"));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq(CHANNEL), json.capture());
        JsonNode sent = objectMapper.readTree(json.getValue());
        assertThat(sent.get("destination").asText()).isEqualTo("/topic/execution/e1");
        assertThat(sent.at("/payload/nodeId").asText()).isEqualTo("swap-1");
    }

    @Test
    void forwardsReceivedMessageToLocalBroker() {
        String body = "{\"destination\":\"/topic/execution/e2\",\"payload\":{\"status\":\"RUNNING\"}}";
        when(message.getBody()).thenReturn(body.getBytes(StandardCharsets.UTF_8));

        bridge.onMessage(message, null);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/execution/e2"), payload.capture());
        assertThat(((JsonNode) payload.getValue()).get("status").asText()).isEqualTo("RUNNING");
    }
}
