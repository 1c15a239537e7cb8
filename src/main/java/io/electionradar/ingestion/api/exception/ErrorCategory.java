package io.electionradar.ingestion.api.exception;

public enum ErrorCategory {
    TIMEOUT(true),              // Connection/read timeout
    CONNECTION_REFUSED(true),   // Connection refused
    DNS_ERROR(true),            // Unknown host
    NETWORK_ERROR(true),        // Other network issues
    IO_ERROR(true),             // I/O problems
    INVALID_URL(false),         // Malformed URL
    NOT_FOUND(false),           // 404, definitive empty
    ACCESS_FORBIDDEN(true),     // 403
    AUTH_REQUIRED(true),        // 401
    SERVER_ERROR(true),         // 500
    SERVER_UNAVAILABLE(true),   // 502/503/504
    HTTP_ERROR(true),           // Other non-2xx
    PARSE_ERROR(false),         // Malformed or entry-less feed, definitive empty
    RATE_LIMITED(true),         // 429 Too Many Requests
    UNKNOWN(false);             // Unexpected errors

    private final boolean transientFailure;

    ErrorCategory(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether another attempt within the same run may succeed.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Definitive outcomes that mean "this feed has nothing for us", not a failure.
     */
    public boolean isDefinitiveEmpty() {
        return this == NOT_FOUND || this == PARSE_ERROR;
    }
}
