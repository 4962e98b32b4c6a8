package dev.careercrawler.scheduler;

import dev.careercrawler.PipelineRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts a crawl on the configured cron schedule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraping.schedule", name = "enabled", havingValue = "true")
public class ScheduledCrawlTrigger {

    private final PipelineRunner pipelineRunner;

    @Scheduled(cron = "${scraping.schedule.cron:0 0 9 * * *}", zone = "${scraping.schedule.zone:UTC}")
    public void scheduledRun() {
        log.info("Running scheduled crawl...");
        try {
            pipelineRunner.execute();
        } catch (IllegalStateException e) {
            // Next trigger retries; the failure is already logged with its cause
            log.error("Scheduled crawl failed: {}", e.getMessage());
        }
    }
}
