package io.electionradar.ingestion.pipeline;

import io.electionradar.ingestion.api.dto.ScoredArticle;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Admitted articles in publish order: highest score first, ties kept in arrival order
 * (newest first). Decides, item by item, whether publishing may continue.
 */
public class TriageQueue {

    public enum Halt {
        NONE,
        DEADLINE,
        BATCH_FULL,
        RATE_LIMITED
    }

    private final Deque<ScoredArticle> pending;
    private final int batchSize;
    private final RateLimiter rateLimiter;
    private int published;

    public TriageQueue(List<ScoredArticle> admitted, int batchSize, RateLimiter rateLimiter) {
        List<ScoredArticle> sorted = new ArrayList<>(admitted);
        // List.sort is stable
        sorted.sort(Comparator.comparingInt(ScoredArticle::score).reversed());
        this.pending = new ArrayDeque<>(sorted);
        this.batchSize = batchSize;
        this.rateLimiter = rateLimiter;
    }

    public boolean hasNext() {
        return !pending.isEmpty();
    }

    /**
     * Checked before every item, in priority order: time, batch size, rate window.
     */
    public Halt checkHalt(DeadlineBudget budget, Duration stopMargin) {
        if (!budget.hasAtLeast(stopMargin)) return Halt.DEADLINE;
        if (published >= batchSize) return Halt.BATCH_FULL;
        if (!rateLimiter.canPost()) return Halt.RATE_LIMITED;
        return Halt.NONE;
    }

    public ScoredArticle poll() {
        return pending.pollFirst();
    }

    public void markPublished() {
        published++;
        rateLimiter.recordPost();
    }

    public boolean isBatchFull() {
        return published >= batchSize;
    }

    /**
     * Drops everything still pending and returns how many items that was.
     */
    public int drainOverflow() {
        int overflow = pending.size();
        pending.clear();
        return overflow;
    }

    public int size() {
        return pending.size();
    }

    public int published() {
        return published;
    }
}
