package com.pulseflow.pulseflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulseflow.pulseflow_backend.engine.RedisWebSocketBridge;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Only active when a Redis URL is configured; a single instance publishes straight to its own broker.
 * All instances must share {@code pulseflow.web.redis-channel}.
 */
@Configuration
@ConditionalOnProperty(prefix = "spring.data.redis", name = "url")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper,
                                                     WebProperties webProperties) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper, webProperties.redisChannel());
    }

    @Bean
    public RedisMessageListenerContainer progressEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                        RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(bridge.getChannel()));
        return container;
    }
}
