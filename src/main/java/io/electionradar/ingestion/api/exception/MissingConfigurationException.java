package io.electionradar.ingestion.api.exception;

import java.util.List;

/**
 * Required credentials or identifiers are absent. The only condition that aborts a run.
 */
public class MissingConfigurationException extends RuntimeException {
    private final List<String> missingKeys;

    public MissingConfigurationException(List<String> missingKeys) {
        super("Missing required configuration: " + String.join(", ", missingKeys));
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
