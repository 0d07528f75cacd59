package com.copytraderadar.notification.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the Telegram transport throttle from copytrade.notification.telegram.
 */
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfig {

    @Bean(name = "telegramRateLimiter")
    public RateLimiter telegramRateLimiter(NotificationProperties properties) {
        NotificationProperties.Telegram telegram = properties.getTelegram();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, telegram.getMaxMessagesPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, telegram.getTimeoutMs())))
                .build();
        return RateLimiter.of("telegram", config);
    }
}
