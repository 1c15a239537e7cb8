package io.electionradar.ingestion.history;

import java.util.List;

/**
 * Persisted publish history shared by every execution of the pipeline.
 */
public interface HistoryStore {

    /**
     * Most recent records, newest first.
     *
     * @throws io.electionradar.ingestion.api.exception.HistoryStoreException on transport or server failure
     */
    List<StoredRecord> loadRecent(int limit);

    /**
     * Creates the record under its content hash.
     *
     * @return {@code false} if the key already exists
     * @throws io.electionradar.ingestion.api.exception.HistoryStoreException if the write failed
     */
    boolean save(PublishRecord record);

    /**
     * Removes a record written by {@link #save(PublishRecord)} whose delivery then failed
     * everywhere, so a later run may pick the story up again.
     */
    boolean release(String contentHash);
}
