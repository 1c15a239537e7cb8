package io.electionradar.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.electionradar.ingestion.pipeline.RunMetrics;
import io.electionradar.ingestion.pipeline.RunStats;

import java.util.List;
import java.util.Map;

/**
 * The one structured result of a pipeline run.
 *
 * @param posted items delivered to at least one platform
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
        String status,
        String error,
        List<String> missingKeys,
        int feedsOk,
        int feedsFailed,
        int feedsRetried,
        int entriesTotal,
        int skippedTime,
        int skippedLowRelevance,
        int skippedDuplicate,
        int queuedHigh,
        int queuedMedium,
        int queuedLow,
        Map<String, Integer> postedByPlatform,
        int posted,
        int errors,
        int overflow,
        boolean historyDegraded,
        long elapsedMs,
        RunMetrics.Snapshot metrics
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String ERROR_MISSING_CONFIG = "missing_config";

    public static RunSummary of(RunStats stats, RunMetrics.Snapshot metrics, long elapsedMs) {
        return new RunSummary(
                STATUS_SUCCESS, null, null,
                stats.feedsOk(), stats.feedsFailed(), stats.feedsRetried(),
                stats.entriesTotal(),
                stats.skippedTime(), stats.skippedLowRelevance(), stats.skippedDuplicate(),
                stats.queuedHigh(), stats.queuedMedium(), stats.queuedLow(),
                stats.postedByPlatform(), stats.posted(),
                stats.errors(), stats.overflow(), stats.historyDegraded(),
                elapsedMs, metrics
        );
    }

    public static RunSummary missingConfig(List<String> missingKeys, long elapsedMs) {
        return new RunSummary(
                STATUS_ERROR, ERROR_MISSING_CONFIG, List.copyOf(missingKeys),
                0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                Map.of(), 0, 0, 0, false,
                elapsedMs, null
        );
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
