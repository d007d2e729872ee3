package com.tollgate.proxy.core.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final AtomicLong now = new AtomicLong(1_000_000_000L);

    @Test
    void allow_firstRequestTakesTokenFromFreshBucket() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(1), now::get);

        assertThat(limiter.allow("fresh")).isTrue();
        assertThat(limiter.allow("fresh")).isFalse();

        now.addAndGet(Duration.ofSeconds(1).toNanos());
        assertThat(limiter.allow("fresh")).isTrue();
        assertThat(limiter.allow("fresh")).isFalse();
    }

    @Test
    void allow_deniesBeyondCapacityWithinWindow() {
        RateLimiter limiter = new RateLimiter(3, Duration.ofMinutes(1), now::get);

        assertThat(limiter.allow("client")).isTrue();
        assertThat(limiter.allow("client")).isTrue();
        assertThat(limiter.allow("client")).isTrue();
        assertThat(limiter.allow("client")).isFalse();
    }

    @Test
    void allow_refillsOverWindow() {
        RateLimiter limiter = new RateLimiter(2, Duration.ofSeconds(1), now::get);
        limiter.allow("client");
        limiter.allow("client");
        assertThat(limiter.allow("client")).isFalse();

        now.addAndGet(Duration.ofMillis(600).toNanos());
        assertThat(limiter.allow("client")).isTrue();
        assertThat(limiter.allow("client")).isFalse();
    }

    @Test
    void allow_capsRefillAtCapacity() {
        RateLimiter limiter = new RateLimiter(3, Duration.ofSeconds(1), now::get);
        limiter.allow("client");

        now.addAndGet(Duration.ofMinutes(10).toNanos());

        int allowed = 0;
        for (int i = 0; i < 10; i++) {
            if (limiter.allow("client")) {
                allowed++;
            }
        }
        assertThat(allowed).isEqualTo(3);
    }

    @Test
    void allow_keepsBucketsPerIdentifier() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofMinutes(1), now::get);
        limiter.allow("a");

        assertThat(limiter.allow("a")).isFalse();
        assertThat(limiter.allow("b")).isTrue();
        assertThat(limiter.trackedIdentifiers()).isEqualTo(2);
    }

    @Test
    void constructor_rejectsInvalidArguments() {
        assertThatThrownBy(() -> new RateLimiter(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimiter(5, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
