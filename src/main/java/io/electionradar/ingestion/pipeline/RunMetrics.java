package io.electionradar.ingestion.pipeline;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Structured counters of one run. Fetch workers write latencies concurrently.
 */
public class RunMetrics {

    private final AtomicInteger fuzzyMatches = new AtomicInteger();
    private final AtomicInteger hashCollisions = new AtomicInteger();
    private final AtomicInteger postRetries = new AtomicInteger();
    private final AtomicInteger postFallbacks = new AtomicInteger();
    private final Map<String, Long> feedLatenciesMs = new ConcurrentHashMap<>();

    public record Snapshot(
            int fuzzyMatchCount,
            int hashCollisions,
            int postRetries,
            int postFallbacks,
            Map<String, Long> feedLatenciesMs
    ) {}

    public void recordFuzzyMatch() {
        fuzzyMatches.incrementAndGet();
    }

    public void recordHashCollision() {
        hashCollisions.incrementAndGet();
    }

    public void recordPostRetry() {
        postRetries.incrementAndGet();
    }

    public void recordPostFallback() {
        postFallbacks.incrementAndGet();
    }

    public void recordFeedLatency(String source, long millis) {
        feedLatenciesMs.put(source, millis);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                fuzzyMatches.get(),
                hashCollisions.get(),
                postRetries.get(),
                postFallbacks.get(),
                Map.copyOf(new TreeMap<>(feedLatenciesMs))
        );
    }
}
