package io.electionradar.ingestion.platform;

import java.util.List;

/**
 * A channel articles are posted to. Every send either succeeds or throws
 * {@link io.electionradar.ingestion.api.exception.PlatformDeliveryException}
 * ({@link io.electionradar.ingestion.api.exception.PlatformRateLimitedException} for "too many requests").
 */
public interface DeliveryPlatform {

    String name();

    /**
     * A platform without credentials is skipped and never counts as a failure.
     */
    boolean isEnabled();

    /**
     * Multi-image post; the caption is attached to the first image.
     */
    void sendAlbum(List<String> imageUrls, String caption);

    void sendPhoto(String imageUrl, String caption);

    void sendText(String text);
}
