package dev.careercrawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the career pages to crawl and the politeness policy used to fetch them.
 * Loaded from application.yml under 'scraping' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scraping")
public class ScrapingConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; CareerCrawler/1.0; +https://github.com/career-crawler/career-crawler)";

    private List<Target> companies = new ArrayList<>();
    private String userAgent = DEFAULT_USER_AGENT;
    private double requestDelaySeconds = 3;
    private int maxRetries = 3;
    private int requestTimeoutSeconds = 30;
    private Schedule schedule = new Schedule();

    /**
     * Delay between fetch attempts and after every successful fetch.
     */
    public Duration getRequestDelay() {
        return Duration.ofMillis(Math.max(0L, Math.round(requestDelaySeconds * 1000)));
    }

    /**
     * One company career page to crawl.
     */
    @Data
    public static class Target {
        private String name;
        private String url;
        // Name of a registered PostingExtractor; blank means the default heuristic
        private String extractor;
        // CSS selector for posting links; takes precedence over extractor when set
        private String selector;

        public boolean isValid() {
            return name != null && !name.isBlank() && url != null && !url.isBlank();
        }
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 9 * * *";
        private String zone = "UTC";
    }
}
