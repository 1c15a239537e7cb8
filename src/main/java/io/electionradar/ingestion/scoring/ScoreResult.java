package io.electionradar.ingestion.scoring;

import java.util.List;

public record ScoreResult(
        int score,
        Tier tier,
        List<String> entities,
        List<String> topics,
        boolean rejected
) {
    public static ScoreResult rejection() {
        return new ScoreResult(-1, Tier.LOW, List.of(), List.of(), true);
    }
}
