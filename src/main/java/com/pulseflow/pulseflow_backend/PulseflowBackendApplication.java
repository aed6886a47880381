package com.pulseflow.pulseflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PulseflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseflowBackendApplication.class, args);
    }
}
