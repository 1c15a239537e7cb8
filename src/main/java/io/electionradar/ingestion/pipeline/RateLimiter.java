package io.electionradar.ingestion.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding 60-second cap on publish actions. Ask {@link #canPost()} right before each attempt
 * and call {@link #recordPost()} right after each success.
 */
public class RateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Clock clock;
    private final int maxPerMinute;
    private final Deque<Instant> postTimestamps = new ArrayDeque<>();

    public RateLimiter(Clock clock, int maxPerMinute) {
        this.clock = clock;
        this.maxPerMinute = maxPerMinute;
    }

    public synchronized boolean canPost() {
        evictExpired(clock.instant());
        return postTimestamps.size() < maxPerMinute;
    }

    public synchronized void recordPost() {
        Instant now = clock.instant();
        postTimestamps.addLast(now);
        evictExpired(now);
    }

    public synchronized int remaining() {
        evictExpired(clock.instant());
        return Math.max(0, maxPerMinute - postTimestamps.size());
    }

    private void evictExpired(Instant now) {
        Instant threshold = now.minus(WINDOW);
        while (true) {
            Instant head = postTimestamps.peekFirst();
            if (head == null || head.isAfter(threshold)) break;
            postTimestamps.pollFirst();
        }
    }
}
