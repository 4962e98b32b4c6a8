package dev.careercrawler.fetch;

import dev.careercrawler.metrics.CrawlerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches career pages with a fixed number of attempts, linear backoff and a politeness
 * delay after every successful request.
 */
@Slf4j
@Component
public class PageFetcher {

    private static final int MAX_IN_MEMORY_SIZE = 10 * 1024 * 1024;

    private final WebClient webClient;
    private final CrawlerMetrics metrics;

    public PageFetcher(WebClient.Builder webClientBuilder, CrawlerMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,*/*;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
    }

    /**
     * Fetch the page body.
     *
     * @param url    page to fetch
     * @param policy retry and politeness settings
     * @return Mono with the body, or empty when every attempt failed
     */
    public Mono<String> fetch(String url, FetchPolicy policy) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            log.error("Invalid URL {}: {}", url, e.getMessage());
            return Mono.empty();
        }
        String host = uri.getHost() != null ? uri.getHost() : url;

        AtomicInteger attempt = new AtomicInteger();
        long start = System.currentTimeMillis();

        return Mono.defer(() -> {
                    attempt.incrementAndGet();
                    return webClient.get()
                            .uri(uri)
                            .header(HttpHeaders.USER_AGENT, policy.userAgent())
                            .retrieve()
                            .bodyToMono(String.class)
                            .timeout(policy.requestTimeout());
                })
                .doOnError(e -> log.warn("Error fetching {}: {} (attempt {}/{})",
                        url, describe(e), attempt.get(), policy.maxAttempts()))
                .retryWhen(linearBackoff(url, policy))
                .doOnNext(body -> log.debug("Fetched {} ({} chars)", url, body.length()))
                .delayUntil(body -> Mono.delay(policy.baseDelay()))
                .onErrorResume(e -> {
                    log.error("Failed to fetch {} after {} attempts: {}", url, attempt.get(), describe(e));
                    metrics.incrementFetchFailures(host);
                    return Mono.empty();
                })
                .doFinally(signal -> metrics.recordFetchLatency(host, System.currentTimeMillis() - start));
    }

    private Retry linearBackoff(String url, FetchPolicy policy) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long failedAttempts = signal.totalRetries() + 1;
            if (failedAttempts >= policy.maxAttempts()) {
                return Mono.<Long>error(signal.failure());
            }
            Duration wait = policy.backoffAfter(failedAttempts);
            log.info("Retrying {} in {} ms", url, wait.toMillis());
            return Mono.delay(wait);
        }));
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
