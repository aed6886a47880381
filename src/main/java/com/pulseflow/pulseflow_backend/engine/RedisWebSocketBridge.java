package com.pulseflow.pulseflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Fans progress events out through Redis Pub/Sub so every instance receives them.
 * When a run executes on instance A but the dashboard is connected to instance B,
 * instance B picks the event up from Redis and delivers it over its own broker.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    @Getter
    private final String channel;

    public void publish(String destination, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, objectMapper.valueToTree(payload)));
            redisTemplate.convertAndSend(channel, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WebSocket message for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            log.debug("Forwarding Redis message to {}", stomp.destination());
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    // Payload travels as a JSON tree so the receiving instance forwards exactly what was published
    record StompMessage(String destination, JsonNode payload) {}
}
