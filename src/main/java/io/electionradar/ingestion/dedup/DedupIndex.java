package io.electionradar.ingestion.dedup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything already published or accepted: loaded from history once per run and grown as
 * articles are admitted. Only the sequential triage pass writes to it.
 */
public class DedupIndex {

    private final Set<String> fingerprints = new HashSet<>();
    private final Set<String> links = new HashSet<>();
    private final List<FuzzyRecord> records = new ArrayList<>();

    public record FuzzyRecord(String title, Set<String> tokens) {}

    /**
     * @return {@code false} if the fingerprint was already known
     */
    public boolean addFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isEmpty()) {
            return true;
        }
        return fingerprints.add(fingerprint);
    }

    public void addLink(String link) {
        if (link != null && !link.isEmpty()) {
            links.add(link);
        }
    }

    public void addRecord(String title, Set<String> tokens) {
        records.add(new FuzzyRecord(title, Set.copyOf(tokens)));
    }

    public boolean containsFingerprint(String fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    public boolean containsLink(String link) {
        return links.contains(link);
    }

    public List<FuzzyRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int fingerprintCount() {
        return fingerprints.size();
    }

    public int linkCount() {
        return links.size();
    }
}
