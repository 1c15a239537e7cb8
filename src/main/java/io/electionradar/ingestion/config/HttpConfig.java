package io.electionradar.ingestion.config;

import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        int maxRetries,
        int retryDelay,
        int maxRetryDelay,
        List<String> userAgents
) {
    public List<String> userAgentsOrDefault() {
        return userAgents == null || userAgents.isEmpty()
                ? List.of("Mozilla/5.0 (compatible; ElectionRadar/1.0)")
                : userAgents;
    }
}
