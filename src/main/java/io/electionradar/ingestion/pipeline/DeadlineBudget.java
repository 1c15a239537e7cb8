package io.electionradar.ingestion.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Remaining time of one run against a fixed ceiling, measured from the moment the run began.
 */
public final class DeadlineBudget {

    private final Clock clock;
    private final Instant start;
    private final Duration ceiling;

    private DeadlineBudget(Clock clock, Duration ceiling) {
        this.clock = clock;
        this.start = clock.instant();
        this.ceiling = ceiling;
    }

    public static DeadlineBudget start(Clock clock, Duration ceiling) {
        return new DeadlineBudget(clock, ceiling);
    }

    public Duration elapsed() {
        return Duration.between(start, clock.instant());
    }

    /**
     * May be negative once the ceiling has passed.
     */
    public Duration remaining() {
        return ceiling.minus(elapsed());
    }

    /**
     * {@code min(cap, remaining - reserve)}: what a phase may spend while leaving
     * {@code reserve} for everything after it.
     */
    public Duration phaseBudget(Duration cap, Duration reserve) {
        Duration available = remaining().minus(reserve);
        return available.compareTo(cap) < 0 ? available : cap;
    }

    public boolean hasAtLeast(Duration amount) {
        return remaining().compareTo(amount) >= 0;
    }

    public Duration ceiling() {
        return ceiling;
    }

    public String describeRemaining() {
        return String.format("%.1fs left", remaining().toMillis() / 1000.0);
    }
}
