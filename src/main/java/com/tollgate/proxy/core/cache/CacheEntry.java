package com.tollgate.proxy.core.cache;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored backend response and its absolute expiry.
 */
public class CacheEntry {

    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final Instant expires;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public CacheEntry(int status, Map<String, List<String>> headers, byte[] body, Instant expires) {
        this.status = status;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body : new byte[0];
        this.expires = expires;
    }

    /**
     * @param now the current instant.
     * @return true while {@code expires} is strictly after {@code now}.
     */
    public boolean isFresh(Instant now) {
        return expires.isAfter(now);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public Instant getExpires() {
        return expires;
    }
}
