package dev.careercrawler.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables cron-triggered crawls when 'scraping.schedule.enabled' is true.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "scraping.schedule", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
