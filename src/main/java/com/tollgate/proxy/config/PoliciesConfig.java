package com.tollgate.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Request policies applied by the engine.
 */
public class PoliciesConfig {
    private RateLimitPolicy rateLimit = new RateLimitPolicy();
    private CorsPolicy cors = new CorsPolicy();
    private AuthPolicy auth = new AuthPolicy();
    private CachePolicy cache = new CachePolicy();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RateLimitPolicy getRateLimit() {
        return rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRateLimit(RateLimitPolicy rateLimit) {
        this.rateLimit = rateLimit;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CorsPolicy getCors() {
        return cors;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCors(CorsPolicy cors) {
        this.cors = cors;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AuthPolicy getAuth() {
        return auth;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAuth(AuthPolicy auth) {
        this.auth = auth;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CachePolicy getCache() {
        return cache;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCache(CachePolicy cache) {
        this.cache = cache;
    }
}
