package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({PaginationProperties.class, ServiceInfoProperties.class, AuthProperties.class})
public class AppPropertiesConfig {
}
