package io.electionradar.ingestion.config;

import java.time.Duration;

/**
 * Time budget of one pipeline run. Every phase gets
 * {@code min(cap, remaining - reserve)} and is skipped below its minimum.
 */
public record BudgetConfig(
        Duration globalDeadline,
        Duration feedsTotalTimeout,
        Duration feedPhaseReserve,
        Duration minFeedBudget,
        Duration dbTimeout,
        Duration dbPhaseReserve,
        Duration minDbBudget,
        Duration publishStopMargin,
        Duration saveReserve,
        Duration minSaveBudget,
        Duration mediaTimeout,
        Duration mediaReserve,
        Duration minMediaBudget,
        Duration platformTimeout,
        Duration platformReserve,
        Duration minPlatformBudget
) {
    public static BudgetConfig defaults() {
        return new BudgetConfig(
                Duration.ofSeconds(27),
                Duration.ofSeconds(10),
                Duration.ofSeconds(16),
                Duration.ofSeconds(3),
                Duration.ofSeconds(5),
                Duration.ofSeconds(12),
                Duration.ofSeconds(2),
                Duration.ofSeconds(8),
                Duration.ofSeconds(6),
                Duration.ofSeconds(1),
                Duration.ofSeconds(3),
                Duration.ofSeconds(5),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(2),
                Duration.ofSeconds(2)
        );
    }
}
