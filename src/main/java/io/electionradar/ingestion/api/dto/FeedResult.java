package io.electionradar.ingestion.api.dto;

import io.electionradar.ingestion.api.exception.ErrorCategory;

import java.util.List;

/**
 * Outcome of fetching one source.
 *
 * @param retries attempts made after the first one
 * @param failure why the source failed or came back definitively empty; null on success
 */
public record FeedResult(
        String source,
        Status status,
        List<Article> articles,
        int retries,
        ErrorCategory failure
) {
    public enum Status {
        OK,
        EMPTY,
        FAILED
    }

    public static FeedResult ok(String source, List<Article> articles, int retries) {
        return new FeedResult(source, Status.OK, List.copyOf(articles), retries, null);
    }

    public static FeedResult empty(String source, int retries, ErrorCategory reason) {
        return new FeedResult(source, Status.EMPTY, List.of(), retries, reason);
    }

    public static FeedResult failed(String source, int retries, ErrorCategory reason) {
        return new FeedResult(source, Status.FAILED, List.of(), retries, reason);
    }

    /**
     * Empty results count as healthy: the feed answered, it just had nothing for us.
     */
    public boolean isHealthy() {
        return status != Status.FAILED;
    }
}
