package io.electionradar.ingestion.history;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Durable unit written before delivery. Keyed by {@link #contentHash()}, which makes the
 * write an atomic "first publisher wins" gate across concurrent runs.
 */
public record PublishRecord(
        @JsonProperty("link") String link,
        @JsonProperty("title") String title,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("site") String site,
        @JsonProperty("feed_url") String feedUrl,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("created_at") String createdAt
) {
    public StoredRecord toStoredRecord() {
        return new StoredRecord(link, title, contentHash, site);
    }
}
