package io.electionradar.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.events")
public record KafkaProperties(
        boolean enabled,
        String articlePublished,
        String runCompleted
) {}
