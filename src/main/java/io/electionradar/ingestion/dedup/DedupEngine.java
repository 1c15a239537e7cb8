package io.electionradar.ingestion.dedup;

import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.config.DedupConfig;
import io.electionradar.ingestion.history.StoredRecord;
import io.electionradar.ingestion.pipeline.RunLog;
import io.electionradar.ingestion.text.TextNormalizer;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Two-tier duplicate detection: exact (fingerprint, link) and fuzzy (title token overlap).
 */
public class DedupEngine {

    private static final int MIN_FUZZY_TOKENS = 2;

    private final TextNormalizer normalizer;
    private final double jaccardThreshold;
    private final double overlapThreshold;

    public DedupEngine(TextNormalizer normalizer, DedupConfig config) {
        this.normalizer = normalizer;
        this.jaccardThreshold = config.fuzzyThreshold();
        this.overlapThreshold = config.overlapThreshold();
    }

    public DedupIndex buildIndex(List<StoredRecord> history, RunLog log) {
        DedupIndex index = new DedupIndex();
        for (StoredRecord record : history) {
            index.addLink(record.link());
            if (record.contentHash() != null && !record.contentHash().isEmpty()
                    && !index.addFingerprint(record.contentHash())) {
                log.metrics().recordHashCollision();
            }
            index.addRecord(record.title(), normalizer.matchingTokens(record.title()));
        }
        return index;
    }

    /**
     * @param article must already carry its fingerprint
     */
    public DuplicateKind check(ScoredArticle article, DedupIndex index) {
        if (index.containsFingerprint(article.fingerprint())) {
            return DuplicateKind.FINGERPRINT;
        }
        if (index.containsLink(article.link())) {
            return DuplicateKind.LINK;
        }
        if (isFuzzyDuplicate(normalizer.matchingTokens(article.title()), index.records())) {
            return DuplicateKind.FUZZY;
        }
        return DuplicateKind.NONE;
    }

    public boolean isDuplicate(ScoredArticle article, DedupIndex index) {
        return check(article, index).isDuplicate();
    }

    /**
     * Registers an accepted article. Must run before the next candidate is checked.
     */
    public void admit(ScoredArticle article, DedupIndex index) {
        index.addFingerprint(article.fingerprint());
        index.addLink(article.link());
        index.addRecord(article.title(), normalizer.matchingTokens(article.title()));
    }

    public boolean isFuzzyDuplicate(String title, Collection<DedupIndex.FuzzyRecord> records) {
        return isFuzzyDuplicate(normalizer.matchingTokens(title), records);
    }

    private boolean isFuzzyDuplicate(Set<String> incoming, Collection<DedupIndex.FuzzyRecord> records) {
        if (incoming.size() < MIN_FUZZY_TOKENS) {
            return false;
        }
        for (DedupIndex.FuzzyRecord record : records) {
            if (isSimilar(incoming, record.tokens())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Overlap coefficient catches a short headline contained in a longer one; Jaccard catches
     * paraphrases of similar length. Symmetric in its arguments.
     */
    public boolean isSimilar(Set<String> a, Set<String> b) {
        if (a.size() < MIN_FUZZY_TOKENS || b.size() < MIN_FUZZY_TOKENS) {
            return false;
        }
        int intersection = intersectionSize(a, b);
        if (intersection == 0) {
            return false;
        }
        double overlap = (double) intersection / Math.min(a.size(), b.size());
        if (overlap >= overlapThreshold) {
            return true;
        }
        double jaccard = (double) intersection / (a.size() + b.size() - intersection);
        return jaccard >= jaccardThreshold;
    }

    private static int intersectionSize(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int count = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                count++;
            }
        }
        return count;
    }
}
