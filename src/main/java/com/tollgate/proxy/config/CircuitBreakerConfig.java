package com.tollgate.proxy.config;

/**
 * Circuit breaker thresholds for a route.
 */
public class CircuitBreakerConfig {
    private boolean enabled;
    /** Failures that open the breaker. */
    private int failureThreshold = 5;
    /** Half-open successes that close it. */
    private int successThreshold = 2;
    /** Time open before a trial call. */
    private long timeoutMs = 30000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public void setSuccessThreshold(int successThreshold) {
        this.successThreshold = successThreshold;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
