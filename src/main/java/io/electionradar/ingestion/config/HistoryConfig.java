package io.electionradar.ingestion.config;

import java.time.Duration;

public record HistoryConfig(
        String type,
        String endpoint,
        String project,
        String key,
        String databaseId,
        String collectionId,
        Duration recordTtl
) {
    public boolean isRedis() {
        return "redis".equalsIgnoreCase(type);
    }
}
