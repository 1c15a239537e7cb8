package io.electionradar.ingestion.config;

import java.time.Duration;

public record PublishConfig(
        int batchSize,
        int rateLimitPerMinute,
        Duration interPostDelay,
        Duration interPostMinRemaining,
        int maxImages,
        int captionMax,
        int maxDescChars,
        int postRetries,
        Duration maxRetryAfter,
        Duration retryAfterMargin,
        boolean releaseOnDeliveryFailure,
        String channelHandle,
        String channelSignature
) {}
