package com.tollgate.proxy.core.ratelimit;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Token bucket limiter keyed by an arbitrary identifier (usually a client IP).
 *
 * <p>
 * Each bucket holds up to {@code maxRequests} tokens and refills continuously at
 * {@code maxRequests / window}. A bucket is created full on first sight and the
 * first request takes a token from it. Refill is lazy; no timer is involved. A single lock guards the
 * bucket map.
 * </p>
 */
public class RateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final double tokensPerNano;
    private final LongSupplier clock;
    private final Map<String, Bucket> buckets = new HashMap<>();

    public RateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, System::nanoTime);
    }

    /**
     * Creates a limiter with an explicit clock.
     *
     * @param maxRequests bucket capacity.
     * @param window      time to refill an empty bucket.
     * @param clock       nanosecond time source.
     */
    public RateLimiter(int maxRequests, Duration window, LongSupplier clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.tokensPerNano = maxRequests / (double) window.toNanos();
        this.clock = clock;
    }

    /**
     * Admits or denies one request for the identifier.
     *
     * @param identifier bucket key.
     * @return true if allowed.
     */
    public synchronized boolean allow(String identifier) {
        long now = clock.getAsLong();
        Bucket bucket = buckets.get(identifier);
        if (bucket == null) {
            buckets.put(identifier, new Bucket(maxRequests - 1, now));
            return true;
        }

        long elapsed = now - bucket.lastTouch;
        if (elapsed > 0) {
            bucket.tokens = Math.min(maxRequests, bucket.tokens + elapsed * tokensPerNano);
        }
        bucket.lastTouch = now;

        if (bucket.tokens >= 1) {
            bucket.tokens -= 1;
            return true;
        }
        return false;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    synchronized int trackedIdentifiers() {
        return buckets.size();
    }

    private static final class Bucket {
        private double tokens;
        private long lastTouch;

        Bucket(double tokens, long lastTouch) {
            this.tokens = tokens;
            this.lastTouch = lastTouch;
        }
    }
}
