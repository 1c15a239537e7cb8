package io.electionradar.ingestion.scoring;

import java.util.List;

public record TopicRule(
        String topic,
        String hashtag,
        List<KeywordPattern> patterns
) {
    public boolean matches(String normalizedText) {
        for (KeywordPattern pattern : patterns) {
            if (pattern.matches(normalizedText)) {
                return true;
            }
        }
        return false;
    }
}
