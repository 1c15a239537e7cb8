package io.electionradar.ingestion.config;

import java.util.Set;

public record DedupConfig(
        double fuzzyThreshold,
        double overlapThreshold,
        int historyLimit,
        Set<String> stopwords
) {}
