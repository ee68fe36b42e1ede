package com.caf.backend.global.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the post-commit notification pipeline and realtime pushes.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor(
            @Value("${caf.notification.executor.core-size:4}") int coreSize,
            @Value("${caf.notification.executor.max-size:8}") int maxSize,
            @Value("${caf.notification.executor.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "realtimeExecutor")
    public ThreadPoolTaskExecutor realtimeExecutor(
            @Value("${caf.realtime.executor.core-size:4}") int coreSize,
            @Value("${caf.realtime.executor.max-size:16}") int maxSize
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(2_000);
        executor.setThreadNamePrefix("realtime-");
        executor.initialize();
        return executor;
    }
}
