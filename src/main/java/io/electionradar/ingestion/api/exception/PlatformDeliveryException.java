package io.electionradar.ingestion.api.exception;

public class PlatformDeliveryException extends RuntimeException {
    private final String platform;

    public PlatformDeliveryException(String platform, String message) {
        super(platform + ": " + message);
        this.platform = platform;
    }

    public PlatformDeliveryException(String platform, String message, Throwable cause) {
        super(platform + ": " + message, cause);
        this.platform = platform;
    }

    public String getPlatform() {
        return platform;
    }
}
