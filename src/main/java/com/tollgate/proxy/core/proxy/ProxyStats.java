package com.tollgate.proxy.core.proxy;

/**
 * Snapshot of engine counters.
 *
 * @param requestCount requests that entered the pipeline.
 * @param errorCount   responses with a status of 400 or above.
 * @param cacheSize    entries in the response cache, expired ones included.
 */
public record ProxyStats(long requestCount, long errorCount, int cacheSize) {
}
