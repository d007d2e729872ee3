package com.tollgate.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Response caching.
 */
public class CachePolicy {
    private boolean enabled;
    private long ttlMs = 60000;
    private List<String> methods = new ArrayList<>(List.of("GET"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public void setTtlMs(long ttlMs) {
        this.ttlMs = ttlMs;
    }

    public List<String> getMethods() {
        return methods == null ? null : Collections.unmodifiableList(methods);
    }

    public void setMethods(List<String> methods) {
        this.methods = methods == null ? null : new ArrayList<>(methods);
    }
}
