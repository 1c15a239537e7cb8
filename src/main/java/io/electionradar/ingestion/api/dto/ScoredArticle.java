package io.electionradar.ingestion.api.dto;

import io.electionradar.ingestion.scoring.ScoreResult;
import io.electionradar.ingestion.scoring.Tier;

import java.util.List;

public record ScoredArticle(
        Article article,
        int score,
        Tier tier,
        List<String> entities,
        List<String> topics,
        String fingerprint
) {
    public static ScoredArticle of(Article article, ScoreResult result) {
        return new ScoredArticle(article, result.score(), result.tier(),
                result.entities(), result.topics(), null);
    }

    public ScoredArticle withFingerprint(String fingerprint) {
        return new ScoredArticle(article, score, tier, entities, topics, fingerprint);
    }

    public String title() {
        return article.title();
    }

    public String link() {
        return article.link();
    }

    public String source() {
        return article.source();
    }
}
