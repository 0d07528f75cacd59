package com.copytraderadar.ingestion.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers webhook signature policy and tracked-token table.
 */
@Configuration
@EnableConfigurationProperties({ WebhookProperties.class, TrackedTokenProperties.class })
public class IngestionConfig {
}
