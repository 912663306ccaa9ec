package com.koni.tracking.infrastructure.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background jobs. Setting {@code tracking.scheduling.enabled=false}
 * turns them off, e.g. in tests that drive the services directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "tracking.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {
}
