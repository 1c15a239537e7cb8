package io.electionradar.ingestion.dedup;

import io.electionradar.ingestion.text.TextNormalizer;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.TreeSet;

/**
 * Order-independent identity of a story. Only the title is used: descriptions differ between
 * republications of the same story, titles mostly just get their clauses reordered.
 */
public class ContentFingerprinter {

    private final TextNormalizer normalizer;

    public ContentFingerprinter(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * SHA-256 hex of the sorted distinct matching tokens of {@code title}, joined by single spaces.
     */
    public String fingerprint(String title) {
        TreeSet<String> tokens = new TreeSet<>(normalizer.matchingTokens(title));
        return DigestUtils.sha256Hex(String.join(" ", tokens));
    }
}
