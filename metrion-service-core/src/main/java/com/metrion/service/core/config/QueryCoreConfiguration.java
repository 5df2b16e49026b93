package com.metrion.service.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the query compiler beans. Applications import this and provide a {@link
 * com.metrion.service.core.spi.StorageExecutor} and a {@link
 * com.metrion.service.core.spi.StatisticsExecutor}.
 */
@Configuration
@ComponentScan(basePackages = "com.metrion.service.core")
@EnableConfigurationProperties
public class QueryCoreConfiguration {}
