package io.electionradar.ingestion.config;

/**
 * Bot-API style messaging channel. The same shape serves Telegram and Bale.
 */
public record PlatformConfig(
        String baseUrl,
        String token,
        String chatId
) {
    public boolean isConfigured() {
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }
}
