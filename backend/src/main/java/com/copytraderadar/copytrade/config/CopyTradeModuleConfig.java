package com.copytraderadar.copytrade.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CopyTradeDefaultsProperties.class)
public class CopyTradeModuleConfig {
}
