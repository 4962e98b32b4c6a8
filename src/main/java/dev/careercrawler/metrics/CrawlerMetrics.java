package dev.careercrawler.metrics;

import dev.careercrawler.model.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for crawl runs.
 */
@Component
public class CrawlerMetrics {

    private static final String TAG_TARGET = "target";
    private final MeterRegistry registry;

    // Counters
    private final Counter candidatesFoundCounter;
    private final Counter candidatesRejectedCounter;
    private final Counter postingsStoredCounter;
    private final Counter duplicatesCounter;
    private final Counter alertsSentCounter;
    private final Counter alertFailuresCounter;
    private final Counter fetchFailuresCounter;

    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunTargetsFailed = new AtomicInteger(0);
    private final AtomicInteger lastRunPostingsStored = new AtomicInteger(0);
    private final AtomicInteger lastRunAlertsSent = new AtomicInteger(0);

    public CrawlerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.candidatesFoundCounter = Counter.builder("career_crawler_candidates_found_total")
                .description("Candidate postings extracted from career pages")
                .register(registry);

        this.candidatesRejectedCounter = Counter.builder("career_crawler_candidates_rejected_total")
                .description("Candidates rejected by the preference filter")
                .register(registry);

        this.postingsStoredCounter = Counter.builder("career_crawler_postings_stored_total")
                .description("New postings persisted")
                .register(registry);

        this.duplicatesCounter = Counter.builder("career_crawler_duplicates_total")
                .description("Candidates skipped because their URL was already stored")
                .register(registry);

        this.alertsSentCounter = Counter.builder("career_crawler_alerts_sent_total")
                .description("Alerts delivered to Discord")
                .register(registry);

        this.alertFailuresCounter = Counter.builder("career_crawler_alert_failures_total")
                .description("Alerts that failed to deliver")
                .register(registry);

        this.fetchFailuresCounter = Counter.builder("career_crawler_fetch_failures_total")
                .description("Career pages that could not be fetched after all retries")
                .register(registry);

        Gauge.builder("career_crawler_last_run_targets_failed", lastRunTargetsFailed, AtomicInteger::get)
                .description("Targets that failed in last run")
                .register(registry);

        Gauge.builder("career_crawler_last_run_postings_stored", lastRunPostingsStored, AtomicInteger::get)
                .description("Postings stored in last run")
                .register(registry);

        Gauge.builder("career_crawler_last_run_alerts_sent", lastRunAlertsSent, AtomicInteger::get)
                .description("Alerts sent in last run")
                .register(registry);
    }

    public Timer getFetchTimer(String host) {
        return fetchTimers.computeIfAbsent(host, name ->
                Timer.builder("career_crawler_fetch_duration")
                        .description("Time to fetch a career page, retries included")
                        .tag(TAG_TARGET, name)
                        .register(registry)
        );
    }

    public void recordCandidatesFound(int count) {
        candidatesFoundCounter.increment(count);
    }

    public void recordCandidatesRejected(int count) {
        candidatesRejectedCounter.increment(count);
    }

    public void recordPostingsStored(int count) {
        postingsStoredCounter.increment(count);
    }

    public void recordDuplicates(int count) {
        duplicatesCounter.increment(count);
    }

    public void recordAlertSent() {
        alertsSentCounter.increment();
    }

    public void recordAlertFailure() {
        alertFailuresCounter.increment();
    }

    /**
     * Increment fetch failures, overall and for the given target.
     */
    public void incrementFetchFailures(String target) {
        fetchFailuresCounter.increment();
        Counter.builder("career_crawler_fetch_failures_by_target_total")
                .tag(TAG_TARGET, target)
                .register(registry)
                .increment();
    }

    public void recordFetchLatency(String host, long latencyMs) {
        getFetchTimer(host).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(RunSummary summary) {
        lastRunTargetsFailed.set(summary.targetsFailed());
        lastRunPostingsStored.set(summary.postingsStored());
        lastRunAlertsSent.set(summary.alertsSent());
    }
}
