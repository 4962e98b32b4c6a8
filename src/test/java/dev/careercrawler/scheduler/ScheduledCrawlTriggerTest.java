package dev.careercrawler.scheduler;

import dev.careercrawler.PipelineRunner;
import dev.careercrawler.model.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledCrawlTriggerTest {

    @Mock
    private PipelineRunner pipelineRunner;

    @Test
    void shouldRunPipelineOnTrigger() {
        when(pipelineRunner.execute()).thenReturn(RunSummary.of(List.of(), 0));

        new ScheduledCrawlTrigger(pipelineRunner).scheduledRun();

        verify(pipelineRunner).execute();
    }

    @Test
    void failedRunShouldNotStopTheSchedule() {
        when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Pipeline execution failed"));

        assertThatCode(() -> new ScheduledCrawlTrigger(pipelineRunner).scheduledRun())
                .doesNotThrowAnyException();
    }
}
