package io.electionradar.ingestion.api.exception;

public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message) {
        super(message);
    }

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
