package com.pulseflow.pulseflow_backend.config;

import com.pulseflow.pulseflow_backend.executor.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /** Runs workflow executions off the request thread. Each run occupies one thread until it finishes. */
    @Bean(name = "workflowRunExecutor")
    public Executor workflowRunExecutor(@Value("${pulseflow.runs.max-concurrent:8}") int maxConcurrent) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrent);
        executor.setMaxPoolSize(maxConcurrent);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("workflow-run-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
