package io.electionradar.ingestion.config;

public record HashtagRule(
        String keyword,
        String hashtag
) {}
