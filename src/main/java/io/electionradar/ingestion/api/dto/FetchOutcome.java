package io.electionradar.ingestion.api.dto;

import java.util.List;

/**
 * Aggregate of one fetch phase.
 *
 * @param abandoned sources still running when the phase deadline fired; also counted in {@code failed}
 */
public record FetchOutcome(
        List<Article> articles,
        int ok,
        int failed,
        int retried,
        int abandoned
) {
    public static FetchOutcome none() {
        return new FetchOutcome(List.of(), 0, 0, 0, 0);
    }

    public boolean isPartial() {
        return abandoned > 0;
    }
}
