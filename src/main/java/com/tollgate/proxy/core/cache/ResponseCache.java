package com.tollgate.proxy.core.cache;

import com.tollgate.proxy.core.backend.Server;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Response store keyed by method, path and backend URL.
 * Entries are served until they expire. Expired entries stay in the map until
 * they are overwritten or the whole store is cleared. Unbounded.
 */
public class ResponseCache {

    private final Clock clock;
    private final Map<String, CacheEntry> entries = new HashMap<>();

    public ResponseCache() {
        this(Clock.systemUTC());
    }

    public ResponseCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the cache key for a request served by the given server.
     *
     * @param method HTTP method.
     * @param path   request path, without the query.
     * @param server the chosen server.
     * @return the key.
     */
    public static String key(String method, String path, Server server) {
        return method + ":" + path + ":" + server.getUrl();
    }

    /**
     * @param key cache key.
     * @return the entry if present and unexpired, else null.
     */
    public synchronized CacheEntry get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !entry.isFresh(clock.instant())) {
            return null;
        }
        return entry;
    }

    /**
     * Stores a response, replacing any previous entry for the key.
     *
     * @param key     cache key.
     * @param status  HTTP status.
     * @param headers response headers.
     * @param body    body bytes.
     * @param ttl     time to live.
     */
    public void put(String key, int status, Map<String, List<String>> headers, byte[] body, Duration ttl) {
        CacheEntry entry = new CacheEntry(status, headers, body, clock.instant().plus(ttl));
        synchronized (this) {
            entries.put(key, entry);
        }
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * @return number of stored entries, expired ones included.
     */
    public synchronized int size() {
        return entries.size();
    }
}
