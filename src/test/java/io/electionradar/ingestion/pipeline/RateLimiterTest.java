package io.electionradar.ingestion.pipeline;

import io.electionradar.ingestion.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2026-10-19T08:00:00Z");

    @Test
    void shouldAllowUpToLimitWithinWindow() {
        RateLimiter limiter = new RateLimiter(clock, 3);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.canPost()).isTrue();
            limiter.recordPost();
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(limiter.canPost()).isFalse();
        assertThat(limiter.remaining()).isZero();
    }

    @Test
    void shouldFreeSlotsAsPostsLeaveTheWindow() {
        RateLimiter limiter = new RateLimiter(clock, 2);
        limiter.recordPost();
        clock.advance(Duration.ofSeconds(30));
        limiter.recordPost();

        clock.advance(Duration.ofSeconds(29));
        assertThat(limiter.canPost()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.canPost()).isTrue();
        assertThat(limiter.remaining()).isEqualTo(1);
    }

    @Test
    void shouldNeverExceedLimitOverAnySixtySecondSpan() {
        RateLimiter limiter = new RateLimiter(clock, 8);
        int posted = 0;

        // one attempt every 2 seconds for 2 simulated minutes
        for (int i = 0; i < 60; i++) {
            if (limiter.canPost()) {
                limiter.recordPost();
                posted++;
            }
            clock.advance(Duration.ofSeconds(2));
        }

        assertThat(posted).isEqualTo(16);
    }

    @Test
    void shouldBlockEverythingWhenLimitIsZero() {
        RateLimiter limiter = new RateLimiter(clock, 0);

        assertThat(limiter.canPost()).isFalse();
    }
}
