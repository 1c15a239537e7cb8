package io.electionradar.ingestion.dedup;

public enum DuplicateKind {
    NONE,
    FINGERPRINT,
    LINK,
    FUZZY;

    public boolean isDuplicate() {
        return this != NONE;
    }
}
