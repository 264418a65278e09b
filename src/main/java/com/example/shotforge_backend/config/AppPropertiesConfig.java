package com.example.shotforge_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({BillingProperties.class, AuditProperties.class})
public class AppPropertiesConfig {
}
