package io.electionradar.ingestion.history;

/**
 * What a history load returns: enough to rebuild the dedup index.
 */
public record StoredRecord(
        String link,
        String title,
        String contentHash,
        String site
) {}
