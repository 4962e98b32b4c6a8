package dev.careercrawler.fetch;

import dev.careercrawler.config.ScrapingConfig;

import java.time.Duration;

/**
 * Retry and politeness settings for fetching one page.
 *
 * @param userAgent      identifying User-Agent sent with every attempt
 * @param maxRetries     total number of attempts
 * @param baseDelay      politeness delay after success and unit of the linear backoff
 * @param requestTimeout timeout of a single attempt
 */
public record FetchPolicy(
        String userAgent,
        int maxRetries,
        Duration baseDelay,
        Duration requestTimeout) {

    public static FetchPolicy from(ScrapingConfig config) {
        String userAgent = (config.getUserAgent() == null || config.getUserAgent().isBlank())
                ? ScrapingConfig.DEFAULT_USER_AGENT
                : config.getUserAgent();
        return new FetchPolicy(
                userAgent,
                config.getMaxRetries(),
                config.getRequestDelay(),
                Duration.ofSeconds(Math.max(1, config.getRequestTimeoutSeconds())));
    }

    public int maxAttempts() {
        return Math.max(1, maxRetries);
    }

    /**
     * Wait before the next attempt once {@code failedAttempts} attempts have failed.
     */
    public Duration backoffAfter(long failedAttempts) {
        return baseDelay.multipliedBy(failedAttempts + 1);
    }
}
