package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pool used by {@link com.example.mediacatalog_backend.service.DeletionWorker}
 * to run claimed deletion requests.
 */
@Configuration
@EnableConfigurationProperties(DeletionWorkerProperties.class)
public class DeletionWorkerConfig {

    @Bean(name = "deletionTaskExecutor")
    public ThreadPoolTaskExecutor deletionTaskExecutor(DeletionWorkerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("deletion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
