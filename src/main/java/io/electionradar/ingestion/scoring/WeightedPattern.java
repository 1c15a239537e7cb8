package io.electionradar.ingestion.scoring;

public record WeightedPattern(
        KeywordPattern pattern,
        int titleWeight,
        int descriptionWeight
) {}
