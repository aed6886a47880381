package com.pulseflow.pulseflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Browser-facing settings shared by the REST CORS filter, the STOMP endpoint and the Redis fan-out.
 */
@ConfigurationProperties(prefix = "pulseflow.web")
public record WebProperties(
        @DefaultValue("http://localhost:3000") List<String> allowedOrigins,
        @DefaultValue("/ws") String stompEndpoint,
        @DefaultValue("pulseflow:websocket:topic") String redisChannel
) {
}
