package dev.careercrawler;

import dev.careercrawler.model.RunSummary;
import dev.careercrawler.service.CrawlPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the crawl pipeline to completion on the calling thread.
 * Shared by the one-shot entry point and the scheduled trigger; overlapping runs are refused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private final CrawlPipelineService crawlPipelineService;
  private final AtomicBoolean running = new AtomicBoolean(false);

  /**
   * Executes one crawl run and waits for it.
   *
   * @return summary of the run, or an empty summary if another run was in progress
   * @throws IllegalStateException if the run failed as a whole
   */
  public RunSummary execute() {
    if (!running.compareAndSet(false, true)) {
      log.warn("A crawl run is already in progress. Skipping this trigger.");
      return RunSummary.of(List.of(), 0);
    }

    try {
      RunSummary summary = Optional.ofNullable(crawlPipelineService.runPipeline().block())
          .orElseGet(() -> RunSummary.of(List.of(), 0));
      log.info("Crawl completed: {} new postings, {} alerts sent",
          summary.postingsStored(), summary.alertsSent());
      return summary;
    } catch (Exception e) {
      log.error("Crawl failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    } finally {
      running.set(false);
    }
  }
}
