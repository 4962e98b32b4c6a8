package dev.careercrawler;

import dev.careercrawler.model.RunSummary;
import dev.careercrawler.model.TargetResult;
import dev.careercrawler.service.CrawlPipelineService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private CrawlPipelineService crawlPipelineService;

  @InjectMocks
  private PipelineRunner pipelineRunner;

  @Test
  void execute_successfulRun_returnsSummary() {
    // Arrange
    RunSummary summary = RunSummary.of(List.of(TargetResult.ok("Acme", 5, 2, 1, 2)), 2);
    when(crawlPipelineService.runPipeline()).thenReturn(Mono.just(summary));

    // Act
    RunSummary result = pipelineRunner.execute();

    // Assert
    assertEquals(2, result.postingsStored());
    assertEquals(2, result.alertsSent());
    verify(crawlPipelineService).runPipeline();
  }

  @Test
  void execute_emptyResult_returnsEmptySummary() {
    // Arrange
    when(crawlPipelineService.runPipeline()).thenReturn(Mono.empty());

    // Act
    RunSummary result = pipelineRunner.execute();

    // Assert
    assertEquals(0, result.targets().size());
    assertEquals(0, result.alertsSent());
  }

  @Test
  void execute_serviceFails_throwsIllegalState() {
    // Arrange
    when(crawlPipelineService.runPipeline()).thenReturn(Mono.error(new IllegalStateException("store down")));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
  }

  @Test
  void execute_afterFailure_allowsNextRun() {
    // Arrange
    when(crawlPipelineService.runPipeline())
        .thenReturn(Mono.error(new RuntimeException("first")))
        .thenReturn(Mono.just(RunSummary.of(List.of(), 0)));

    // Act
    assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
    RunSummary second = pipelineRunner.execute();

    // Assert
    assertEquals(0, second.targetsFailed());
    verify(crawlPipelineService, times(2)).runPipeline();
  }
}
