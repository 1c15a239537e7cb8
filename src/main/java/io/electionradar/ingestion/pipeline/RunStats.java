package io.electionradar.ingestion.pipeline;

import io.electionradar.ingestion.scoring.Tier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable tallies of one run, owned by the coordinating thread.
 */
public class RunStats {

    int feedsOk;
    int feedsFailed;
    int feedsRetried;
    int entriesTotal;
    int skippedTime;
    int skippedLowRelevance;
    int skippedDuplicate;
    int queuedHigh;
    int queuedMedium;
    int queuedLow;
    int posted;
    int errors;
    int overflow;
    boolean historyDegraded;
    final Map<String, Integer> postedByPlatform = new LinkedHashMap<>();

    public void recordFetch(int ok, int failed, int retried, int entries) {
        feedsOk += ok;
        feedsFailed += failed;
        feedsRetried += retried;
        entriesTotal += entries;
    }

    public void recordSkippedTime() {
        skippedTime++;
    }

    public void recordLowRelevance() {
        skippedLowRelevance++;
        queuedLow++;
    }

    public void recordDuplicate() {
        skippedDuplicate++;
    }

    public void recordQueued(Tier tier) {
        if (tier == Tier.HIGH) {
            queuedHigh++;
        } else if (tier == Tier.MEDIUM) {
            queuedMedium++;
        } else {
            queuedLow++;
        }
    }

    public void recordPlatformSuccess(String platform) {
        postedByPlatform.merge(platform, 1, Integer::sum);
    }

    public void registerPlatform(String platform) {
        postedByPlatform.putIfAbsent(platform, 0);
    }

    public void recordPosted() {
        posted++;
    }

    public void recordError() {
        errors++;
    }

    public void recordOverflow(int count) {
        overflow += count;
    }

    public void markHistoryDegraded() {
        historyDegraded = true;
    }

    public int feedsOk() { return feedsOk; }
    public int feedsFailed() { return feedsFailed; }
    public int feedsRetried() { return feedsRetried; }
    public int entriesTotal() { return entriesTotal; }
    public int skippedTime() { return skippedTime; }
    public int skippedLowRelevance() { return skippedLowRelevance; }
    public int skippedDuplicate() { return skippedDuplicate; }
    public int queuedHigh() { return queuedHigh; }
    public int queuedMedium() { return queuedMedium; }
    public int queuedLow() { return queuedLow; }
    public int posted() { return posted; }
    public int errors() { return errors; }
    public int overflow() { return overflow; }
    public boolean historyDegraded() { return historyDegraded; }
    public Map<String, Integer> postedByPlatform() { return Collections.unmodifiableMap(new LinkedHashMap<>(postedByPlatform)); }
}
