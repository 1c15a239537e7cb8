package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.RunSummary;
import io.electionradar.ingestion.pipeline.RunStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledPipelineServiceTest {

    @Mock
    private IngestionPipelineService pipelineService;

    private ScheduledPipelineService service;

    @BeforeEach
    void setUp() {
        service = new ScheduledPipelineService(pipelineService);
    }

    @Test
    void shouldRunPipelineWithScheduledTrigger() {
        when(pipelineService.run(any(), isNull())).thenReturn(RunSummary.of(new RunStats(), null, 100));

        service.runScheduled();

        verify(pipelineService).run(Map.of("trigger", "scheduled"), null);
    }

    @Test
    void shouldSurviveFailedRunAndRunAgainNextTick() {
        when(pipelineService.run(any(), isNull()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(RunSummary.of(new RunStats(), null, 100));

        assertThatCode(service::runScheduled).doesNotThrowAnyException();
        service.runScheduled();

        verify(pipelineService, times(2)).run(any(), isNull());
    }
}
