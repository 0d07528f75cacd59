package com.copytraderadar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. notification-executor runs chat sends off the webhook request path.
 */
@Configuration
public class AsyncConfig {

    public static final String NOTIFICATION_EXECUTOR = "notification-executor";

    /** Bounded queue: when saturated, new notifications are dropped (logged), never block ingestion. */
    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
