package com.tollgate.proxy.core.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link RateLimiter} per tenant. Tenants without a configured limit
 * are never throttled.
 */
public class TenantRateLimiter {

    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    /**
     * Sets (or replaces) a tenant's limit. Replacing drops the tenant's buckets.
     *
     * @param tenant      tenant id.
     * @param maxRequests bucket capacity.
     * @param window      refill window.
     */
    public void setTenantLimit(String tenant, int maxRequests, Duration window) {
        limiters.put(tenant, new RateLimiter(maxRequests, window));
    }

    /**
     * @param tenant     tenant id.
     * @param identifier caller identifier within the tenant.
     * @return true if allowed.
     */
    public boolean check(String tenant, String identifier) {
        RateLimiter limiter = limiters.get(tenant);
        return limiter == null || limiter.allow(identifier);
    }

    public boolean hasLimit(String tenant) {
        return limiters.containsKey(tenant);
    }
}
