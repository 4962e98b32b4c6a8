package dev.careercrawler.service;

import dev.careercrawler.config.DiscordConfig;
import dev.careercrawler.config.PreferencesConfig;
import dev.careercrawler.config.ScrapingConfig;
import dev.careercrawler.config.ScrapingConfig.Target;
import dev.careercrawler.extract.PostingExtractor;
import dev.careercrawler.extract.PostingExtractorResolver;
import dev.careercrawler.fetch.FetchPolicy;
import dev.careercrawler.fetch.PageFetcher;
import dev.careercrawler.metrics.CrawlerMetrics;
import dev.careercrawler.model.CandidatePosting;
import dev.careercrawler.model.RunSummary;
import dev.careercrawler.model.TargetResult;
import dev.careercrawler.service.PostingStore.InsertResult;
import dev.careercrawler.service.PreferenceFilter.FilterVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Set;

/**
 * Drives one crawl run: every target in turn through fetch, extract, filter and store,
 * then a single notification pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlPipelineService {

    private static final String SEPARATOR = "========================================";

    private final ScrapingConfig scrapingConfig;
    private final PreferencesConfig preferences;
    private final DiscordConfig discordConfig;
    private final PageFetcher pageFetcher;
    private final PostingExtractorResolver extractorResolver;
    private final PreferenceFilter preferenceFilter;
    private final PostingStore postingStore;
    private final NotificationService notificationService;
    private final CrawlerMetrics metrics;

    /**
     * Execute the full crawl pipeline.
     * Target failures are logged and summarized; only an unavailable store fails the run.
     *
     * @return summary of the run
     */
    public Mono<RunSummary> runPipeline() {
        List<Target> targets = scrapingConfig.getCompanies();
        FetchPolicy policy = FetchPolicy.from(scrapingConfig);

        log.info(SEPARATOR);
        log.info("Crawl Pipeline Starting");
        log.info(SEPARATOR);
        log.info("Targets configured: {}", targets.size());

        if (targets.isEmpty()) {
            log.warn("No companies configured. Nothing to scrape.");
        }

        return Mono.fromCallable(postingStore::knownUrls)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> new IllegalStateException("Posting store unavailable: " + e.getMessage(), e))
                .flatMap(knownUrls -> Flux.fromIterable(targets)
                        .concatMap(target -> scanTarget(target, policy, knownUrls))
                        .collectList())
                .flatMap(results -> notifyIfEnabled()
                        .map(alertsSent -> RunSummary.of(results, alertsSent)))
                .doOnNext(this::logSummary);
    }

    /**
     * Crawl one target. Never errors: failures are folded into the TargetResult.
     */
    private Mono<TargetResult> scanTarget(Target target, FetchPolicy policy, Set<String> knownUrls) {
        if (!target.isValid()) {
            log.warn("Skipping invalid company entry in config: {}", target);
            return Mono.just(TargetResult.skipped(String.valueOf(target.getName())));
        }

        String name = target.getName();
        log.info("--- Scraping company: {} ({}) ---", name, target.getUrl());

        return pageFetcher.fetch(target.getUrl(), policy)
                .publishOn(Schedulers.boundedElastic())
                .map(content -> processContent(target, content, knownUrls))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.error("Could not fetch page for {}. Skipping.", name);
                    return TargetResult.fetchFailed(name);
                }))
                .onErrorResume(e -> {
                    log.error("Error processing {}: {}", name, e.getMessage(), e);
                    return Mono.just(TargetResult.failed(name));
                });
    }

    private TargetResult processContent(Target target, String content, Set<String> knownUrls) {
        String name = target.getName();
        PostingExtractor extractor = extractorResolver.resolve(target);
        List<CandidatePosting> candidates = extractor.extract(content, target.getUrl());
        log.info("Parsed {} potential jobs from {} (using {}). Filtering...",
                candidates.size(), name, extractor.getName());
        metrics.recordCandidatesFound(candidates.size());

        int stored = 0;
        int duplicates = 0;
        int rejected = 0;

        for (CandidatePosting candidate : candidates) {
            candidate.setCompany(name);

            if (knownUrls.contains(candidate.getUrl())) {
                log.debug("Skipping already existing job URL: {}", candidate.getUrl());
                duplicates++;
                continue;
            }

            FilterVerdict verdict = preferenceFilter.evaluate(candidate, preferences);
            if (!verdict.accepted()) {
                log.debug("Candidate '{}' rejected: {}", candidate.getTitle(), verdict.rejectReason());
                rejected++;
                continue;
            }

            log.info("Found matching job: {} at {}", candidate.getTitle(), name);
            InsertResult result = postingStore.insertIfAbsent(candidate);
            knownUrls.add(candidate.getUrl());
            if (result.isCreated()) {
                stored++;
            } else {
                duplicates++;
            }
        }

        metrics.recordPostingsStored(stored);
        metrics.recordDuplicates(duplicates);
        metrics.recordCandidatesRejected(rejected);
        log.info("Added {} new jobs for {}.", stored, name);
        return TargetResult.ok(name, candidates.size(), stored, duplicates, rejected);
    }

    private Mono<Integer> notifyIfEnabled() {
        if (!discordConfig.isEnabled()) {
            log.info("Discord notifications are disabled. Skipping notification step.");
            return Mono.just(0);
        }

        log.info("Scraping finished. Checking for and sending Discord notifications...");
        return Mono.fromCallable(() -> notificationService.notifyNewPostings(discordConfig.getMaxAlertsPerRun()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("An error occurred during Discord notification: {}", e.getMessage(), e);
                    return Mono.just(0);
                });
    }

    private void logSummary(RunSummary summary) {
        metrics.updateLastRunStats(summary);
        log.info(SEPARATOR);
        log.info("CRAWL SUMMARY: {} targets ({} failed), {} candidates, {} new postings, {} duplicates, {} alerts sent",
                summary.targets().size(), summary.targetsFailed(), summary.candidatesFound(),
                summary.postingsStored(), summary.duplicates(), summary.alertsSent());
        summary.targets().stream()
                .filter(TargetResult::isFailure)
                .forEach(result -> log.info("  - {}: {}", result.target(), result.status()));
        log.info(SEPARATOR);
    }
}
