package com.tollgate.proxy.core.backend;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single backend server owned by one {@link Pool}.
 * The health flag is read and written without any pool-level locking.
 */
public class Server {

    private final URI url;

    /** Reserved for weighted strategies; round robin ignores it. */
    private final int weight;

    private final AtomicBoolean healthy = new AtomicBoolean(true);

    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    Server(URI url, int weight) {
        this.url = url;
        this.weight = weight;
    }

    public URI getUrl() {
        return url;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isHealthy() {
        return healthy.get();
    }

    /**
     * Sets the health flag.
     *
     * @param value new health state.
     * @return the previous health state.
     */
    public boolean setHealthy(boolean value) {
        return healthy.getAndSet(value);
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public void setMetadata(String key, Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    @Override
    public String toString() {
        return url.toString();
    }
}
