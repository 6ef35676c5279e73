package com.transitlog.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables Spring Scheduling only when NOT in the lambda profile.
 * On AWS Lambda the realtime refresh is triggered externally by EventBridge.
 */
@Configuration
@EnableScheduling
@Profile("!lambda")
public class SchedulingConfig {
}
