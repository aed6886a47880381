package com.pulseflow.pulseflow_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

@Configuration
@EnableConfigurationProperties(WebProperties.class)
public class CorsConfig {

    @Bean
    public CorsFilter corsFilter(WebProperties webProperties) {
        return new CorsFilter(corsSource(webProperties));
    }

    // REST API plus the SockJS/STOMP handshake path
    static UrlBasedCorsConfigurationSource corsSource(WebProperties webProperties) {
        CorsConfiguration config = new CorsConfiguration();
        webProperties.allowedOrigins().stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .forEach(config::addAllowedOriginPattern);
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "OPTIONS"));
        config.addAllowedHeader("*");
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);
        source.registerCorsConfiguration(webProperties.stompEndpoint() + "/**", config);
        return source;
    }
}
