package io.electionradar.ingestion.api.util;

import io.electionradar.ingestion.config.IngestionConfig;
import org.springframework.stereotype.Component;

/**
 * Flat view of the scheduling properties for SpEL in {@code @Scheduled}.
 */
@Component("pipelineProps")
public class PipelineProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;
    private final boolean schedulingEnabled;

    public PipelineProps(IngestionConfig config) {
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
        this.schedulingEnabled = config.processing().enableScheduling();
    }

    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
    public boolean isSchedulingEnabled() { return schedulingEnabled; }
}
