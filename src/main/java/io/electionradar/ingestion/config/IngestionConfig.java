package io.electionradar.ingestion.config;

import io.electionradar.ingestion.api.exception.MissingConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ingestion")
public record IngestionConfig(
        List<FeedSource> sources,
        HttpConfig http,
        BudgetConfig budget,
        ProcessingConfig processing,
        ScoringConfig scoring,
        DedupConfig dedup,
        PublishConfig publish,
        PlatformsConfig platforms,
        HistoryConfig history
) {

    public List<FeedSource> getEnabledSources() {
        if (sources == null) {
            return List.of();
        }
        return sources.stream()
                .filter(FeedSource::enabled)
                .toList();
    }

    /**
     * Checks the credentials and identifiers a run cannot do without.
     * Bale is optional; Telegram and the history store are not.
     *
     * @throws MissingConfigurationException listing every missing key
     */
    public void validate() {
        List<String> missing = new ArrayList<>();

        PlatformConfig telegram = platforms != null ? platforms.telegram() : null;
        if (telegram == null || isBlank(telegram.token())) {
            missing.add("ingestion.platforms.telegram.token");
        }
        if (telegram == null || isBlank(telegram.chatId())) {
            missing.add("ingestion.platforms.telegram.chat-id");
        }

        if (history == null) {
            missing.add("ingestion.history");
        } else if (!history.isRedis()) {
            if (isBlank(history.project())) missing.add("ingestion.history.project");
            if (isBlank(history.key())) missing.add("ingestion.history.key");
            if (isBlank(history.databaseId())) missing.add("ingestion.history.database-id");
        }

        if (!missing.isEmpty()) {
            throw new MissingConfigurationException(missing);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
