package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@ConditionalOnProperty(prefix = "ingestion.processing", name = "enable-scheduling", havingValue = "true")
public class ScheduledPipelineService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineService.class);

    private final IngestionPipelineService pipelineService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScheduledPipelineService(IngestionPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(
            fixedRateString = "#{@pipelineProps.scheduleIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void runScheduled() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Previous scheduled run still in progress, skipping this tick");
            return;
        }
        try {
            RunSummary summary = pipelineService.run(Map.of("trigger", "scheduled"), null);
            logger.info("Scheduled run finished: status={}, posted={}, overflow={} in {}ms",
                    summary.status(), summary.posted(), summary.overflow(), summary.elapsedMs());
        } catch (Exception e) {
            logger.error("Scheduled run failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
