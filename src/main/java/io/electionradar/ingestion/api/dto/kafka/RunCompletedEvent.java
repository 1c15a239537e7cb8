package io.electionradar.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record RunCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("status") String status,
        @JsonProperty("feedsOk") int feedsOk,
        @JsonProperty("feedsFailed") int feedsFailed,
        @JsonProperty("entriesTotal") int entriesTotal,
        @JsonProperty("posted") int posted,
        @JsonProperty("postedByPlatform") Map<String, Integer> postedByPlatform,
        @JsonProperty("overflow") int overflow,
        @JsonProperty("errors") int errors,
        @JsonProperty("elapsedMs") long elapsedMs,
        @JsonProperty("completedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant completedAt
) {
    public static RunCompletedEvent create(String status, int feedsOk, int feedsFailed,
                                           int entriesTotal, int posted,
                                           Map<String, Integer> postedByPlatform,
                                           int overflow, int errors, long elapsedMs) {
        return new RunCompletedEvent(
                "RUN-" + System.currentTimeMillis(),
                status, feedsOk, feedsFailed, entriesTotal, posted,
                postedByPlatform, overflow, errors, elapsedMs,
                Instant.now()
        );
    }
}
