package io.electionradar.ingestion.config;

import java.util.List;

public record TopicGroup(
        String name,
        String hashtag,
        List<String> keywords
) {}
