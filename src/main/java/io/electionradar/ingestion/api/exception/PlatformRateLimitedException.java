package io.electionradar.ingestion.api.exception;

import java.time.Duration;

/**
 * The platform answered "too many requests" and asked us to wait {@link #getRetryAfter()}.
 */
public class PlatformRateLimitedException extends PlatformDeliveryException {
    private final Duration retryAfter;

    public PlatformRateLimitedException(String platform, Duration retryAfter) {
        super(platform, "rate limited, retry after " + retryAfter.toSeconds() + "s");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
