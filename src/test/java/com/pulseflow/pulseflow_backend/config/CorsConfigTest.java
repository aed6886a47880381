package com.pulseflow.pulseflow_backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorsConfigTest {

    private final UrlBasedCorsConfigurationSource source = CorsConfig.corsSource(new WebProperties(
            List.of("https://app.pulseflow.io", " https://*.preview.pulseflow.io "), "/ws", "pulseflow:websocket:topic"));

    @Test
    void apiAllowsConfiguredOriginsAndScheduleUpdates() {
        CorsConfiguration config = source.getCorsConfiguration(new MockHttpServletRequest("PUT", "/api/automations/1/schedule"));

        assertThat(config).isNotNull();
        assertThat(config.checkOrigin("https://app.pulseflow.io")).isEqualTo("https://app.pulseflow.io");
        assertThat(config.checkOrigin("https://pr-12.preview.pulseflow.io")).isEqualTo("https://pr-12.preview.pulseflow.io");
        assertThat(config.checkOrigin("https://evil.example")).isNull();
        assertThat(config.getAllowedMethods()).contains("PUT");
    }

    @Test
    void stompHandshakeIsCoveredToo() {
        assertThat(source.getCorsConfiguration(new MockHttpServletRequest("GET", "/ws/info"))).isNotNull();
        assertThat(source.getCorsConfiguration(new MockHttpServletRequest("GET", "/actuator/health"))).isNull();
    }
}
