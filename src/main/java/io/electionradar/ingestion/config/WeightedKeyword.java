package io.electionradar.ingestion.config;

public record WeightedKeyword(
        String keyword,
        int titleWeight,
        int descriptionWeight
) {}
