package com.pulseflow.pulseflow_backend.config;

import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Token amounts exceed the 53-bit range of JavaScript numbers, so every BigInteger leaves the service
 * as a JSON string: REST bodies, STOMP frames, Redis fan-out and stored snapshots alike.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer bigIntegerAsString() {
        return builder -> builder.serializerByType(BigInteger.class, ToStringSerializer.instance);
    }
}
