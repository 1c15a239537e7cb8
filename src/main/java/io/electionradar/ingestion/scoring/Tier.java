package io.electionradar.ingestion.scoring;

public enum Tier {
    HIGH,
    MEDIUM,
    LOW;

    public static Tier of(int score, int highThreshold, int mediumThreshold) {
        if (score >= highThreshold) return HIGH;
        if (score >= mediumThreshold) return MEDIUM;
        return LOW;
    }
}
