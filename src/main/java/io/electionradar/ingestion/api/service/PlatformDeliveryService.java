package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.exception.PlatformDeliveryException;
import io.electionradar.ingestion.api.exception.PlatformRateLimitedException;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.config.PublishConfig;
import io.electionradar.ingestion.pipeline.DeadlineBudget;
import io.electionradar.ingestion.pipeline.RunLog;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Posts one caption to one platform, degrading album to single photo to text-only.
 */
@Service
public class PlatformDeliveryService {

    private final PublishConfig publish;
    private final Sleeper sleeper;

    public PlatformDeliveryService(IngestionConfig config, Sleeper sleeper) {
        this.publish = config.publish();
        this.sleeper = sleeper;
    }

    /**
     * Runs the degrade chain up to {@code post-retries} times. A "too many requests" answer is waited
     * out only when the run budget still covers the wait plus a margin.
     *
     * @return whether the platform accepted the post in some form
     */
    public boolean deliver(DeliveryPlatform platform, List<String> images, String caption,
                           DeadlineBudget budget, RunLog log) {
        int attempts = Math.max(1, publish.postRetries());

        for (int attempt = 0; attempt < attempts; attempt++) {
            boolean lastAttempt = attempt == attempts - 1;
            try {
                attemptChain(platform, images, caption, attempt, log);
                return true;

            } catch (PlatformRateLimitedException e) {
                log.metrics().recordPostRetry();
                Duration wait = e.getRetryAfter().compareTo(publish.maxRetryAfter()) > 0
                        ? publish.maxRetryAfter()
                        : e.getRetryAfter();
                log.warn("{} asked to retry after {}s", platform.name(), e.getRetryAfter().toSeconds());

                if (lastAttempt || !budget.hasAtLeast(wait.plus(publish.retryAfterMargin()))) {
                    log.warn("{}: no budget to wait out rate limit ({}), giving up", platform.name(),
                            budget.describeRemaining());
                    return false;
                }
                if (!pause(wait)) {
                    return false;
                }

            } catch (PlatformDeliveryException e) {
                log.metrics().recordPostRetry();
                log.warn("{} attempt {} failed: {}", platform.name(), attempt + 1, e.getMessage());

                if (lastAttempt && !images.isEmpty()) {
                    log.metrics().recordPostFallback();
                    return sendTextOnly(platform, caption, log);
                }
            }
        }
        return false;
    }

    /**
     * One pass of the chain. Retries after the first start from a single image.
     * A rate-limit answer aborts the pass instead of degrading.
     */
    void attemptChain(DeliveryPlatform platform, List<String> images, String caption, int attempt, RunLog log) {
        List<String> imgs = images.size() > publish.maxImages() ? images.subList(0, publish.maxImages()) : images;
        if (attempt > 0 && imgs.size() > 1) {
            imgs = imgs.subList(0, 1);
        }

        if (imgs.size() >= 2) {
            try {
                platform.sendAlbum(imgs, caption);
                return;
            } catch (PlatformRateLimitedException e) {
                throw e;
            } catch (PlatformDeliveryException e) {
                log.warn("{} album failed: {}", platform.name(), e.getMessage());
                log.metrics().recordPostFallback();
                imgs = imgs.subList(0, 1);
            }
        }

        if (imgs.size() == 1) {
            try {
                platform.sendPhoto(imgs.get(0), caption);
                return;
            } catch (PlatformRateLimitedException e) {
                throw e;
            } catch (PlatformDeliveryException e) {
                log.warn("{} photo failed: {}", platform.name(), e.getMessage());
                log.metrics().recordPostFallback();
            }
        }

        platform.sendText(caption);
    }

    private boolean sendTextOnly(DeliveryPlatform platform, String caption, RunLog log) {
        try {
            platform.sendText(caption);
            return true;
        } catch (PlatformDeliveryException e) {
            log.warn("{} text fallback failed: {}", platform.name(), e.getMessage());
            return false;
        }
    }

    private boolean pause(Duration wait) {
        try {
            sleeper.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
