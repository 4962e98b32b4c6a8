package dev.careercrawler.fetch;

import dev.careercrawler.metrics.CrawlerMetrics;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PageFetcherTest {

  private static final String USER_AGENT = "CareerCrawlerTest/1.0";

  private MockWebServer mockWebServer;
  private PageFetcher pageFetcher;

  @Mock
  private CrawlerMetrics metrics;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    pageFetcher = new PageFetcher(WebClient.builder(), metrics);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  private FetchPolicy policy(int maxRetries) {
    return new FetchPolicy(USER_AGENT, maxRetries, Duration.ZERO, Duration.ofSeconds(5));
  }

  private String url() {
    return mockWebServer.url("/careers").toString();
  }

  @Test
  @DisplayName("Should return body and send the configured User-Agent")
  void shouldReturnBodyAndSendUserAgent() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setBody("<html>jobs</html>"));

    StepVerifier.create(pageFetcher.fetch(url(), policy(3)))
        .expectNext("<html>jobs</html>")
        .verifyComplete();

    RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(request.getHeader("User-Agent")).isEqualTo(USER_AGENT);
    assertThat(request.getPath()).isEqualTo("/careers");
    verify(metrics, never()).incrementFetchFailures(anyString());
  }

  @Test
  @DisplayName("Should retry after a server error")
  void shouldRetryAfterServerError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setBody("ok"));

    StepVerifier.create(pageFetcher.fetch(url(), policy(3)))
        .expectNext("ok")
        .verifyComplete();

    assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should give up after max attempts and report absence")
  void shouldGiveUpAfterMaxAttempts() {
    for (int i = 0; i < 3; i++) {
      mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    }

    StepVerifier.create(pageFetcher.fetch(url(), policy(3)))
        .verifyComplete();

    assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
    verify(metrics).incrementFetchFailures(anyString());
  }

  @Test
  @DisplayName("Should attempt once when max retries is below one")
  void shouldAttemptOnceWhenRetriesBelowOne() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(404));
    mockWebServer.enqueue(new MockResponse().setBody("never reached"));

    StepVerifier.create(pageFetcher.fetch(url(), policy(0)))
        .verifyComplete();

    assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should pause for the base delay after a successful fetch")
  void shouldPauseAfterSuccessfulFetch() {
    mockWebServer.enqueue(new MockResponse().setBody("ok"));
    FetchPolicy polite = new FetchPolicy(USER_AGENT, 3, Duration.ofMillis(300), Duration.ofSeconds(5));

    long start = System.nanoTime();
    StepVerifier.create(pageFetcher.fetch(url(), polite))
        .expectNext("ok")
        .verifyComplete();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
  }

  @Test
  @DisplayName("Should retry a timed-out attempt after the linear backoff")
  void shouldRetryTimeoutAfterBackoff() {
    mockWebServer.enqueue(new MockResponse().setBody("slow").setHeadersDelay(3, TimeUnit.SECONDS));
    mockWebServer.enqueue(new MockResponse().setBody("ok"));
    FetchPolicy policy = new FetchPolicy(USER_AGENT, 3, Duration.ofMillis(400), Duration.ofSeconds(1));

    long start = System.nanoTime();
    StepVerifier.create(pageFetcher.fetch(url(), policy))
        .expectNext("ok")
        .verifyComplete();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    // 1s timeout, then 800ms backoff after the first failure, then 400ms politeness pause
    assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    assertThat(elapsedMs).isGreaterThanOrEqualTo(1000 + 800 + 400);
    verify(metrics, never()).incrementFetchFailures(anyString());
  }

  @Test
  @DisplayName("Should report absence for a malformed URL")
  void shouldReportAbsenceForMalformedUrl() {
    StepVerifier.create(pageFetcher.fetch("http://bad url with spaces", policy(3)))
        .verifyComplete();

    assertThat(mockWebServer.getRequestCount()).isZero();
  }

  @Test
  @DisplayName("Backoff should grow linearly with failed attempts")
  void backoffShouldGrowLinearly() {
    FetchPolicy linear = new FetchPolicy(USER_AGENT, 3, Duration.ofSeconds(2), Duration.ofSeconds(5));

    assertThat(linear.backoffAfter(1)).isEqualTo(Duration.ofSeconds(4));
    assertThat(linear.backoffAfter(2)).isEqualTo(Duration.ofSeconds(6));
    assertThat(linear.maxAttempts()).isEqualTo(3);
    assertThat(policy(-2).maxAttempts()).isEqualTo(1);
  }
}
