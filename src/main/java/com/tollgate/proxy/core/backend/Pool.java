package com.tollgate.proxy.core.backend;

import com.tollgate.proxy.core.exceptions.InvalidUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A named group of interchangeable servers fronting one logical backend.
 * Selects a healthy server by round robin.
 *
 * <p>
 * The server list is guarded by a read/write lock. The rotation counter and
 * each server's health flag are independent atomics, so health updates never
 * wait on list locking. Fairness only holds between health changes: flipping a
 * server's health shifts which server each counter value maps to.
 * </p>
 */
public class Pool {

    private final String id;
    private final List<Server> servers = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger counter = new AtomicInteger(0);

    public Pool(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Parses the URL and appends a new server to the pool.
     *
     * @param rawUrl absolute http(s) base URL of the server.
     * @param weight reserved weight.
     * @return the registered server.
     * @throws InvalidUrlException if the URL is malformed.
     */
    public Server addServer(String rawUrl, int weight) {
        Server server = new Server(parseUrl(rawUrl), weight);
        lock.writeLock().lock();
        try {
            servers.add(server);
        } finally {
            lock.writeLock().unlock();
        }
        return server;
    }

    /**
     * Selects the next healthy server in rotation.
     *
     * @return a healthy server, or {@code null} if none is healthy.
     */
    public Server getServer() {
        List<Server> healthy = getHealthyServers();
        if (healthy.isEmpty()) {
            return null;
        }
        int index = (counter.incrementAndGet() & 0x7FFFFFFF) % healthy.size();
        return healthy.get(index);
    }

    /**
     * Returns the server at the given insertion index.
     *
     * @param index position in insertion order.
     * @return the server, or {@code null} if out of range.
     */
    public Server getServerByIndex(int index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= servers.size()) {
                return null;
            }
            return servers.get(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all registered servers in insertion order.
     *
     * @return unmodifiable copy of the server list.
     */
    public List<Server> getServers() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(servers));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return servers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets a server's health flag.
     *
     * @param server  a server of this pool.
     * @param healthy new state.
     * @return the previous state.
     */
    public boolean setHealth(Server server, boolean healthy) {
        return server.setHealthy(healthy);
    }

    public boolean getHealth(Server server) {
        return server.isHealthy();
    }

    private List<Server> getHealthyServers() {
        List<Server> snapshot = getServers();
        return snapshot.stream()
                .filter(Server::isHealthy)
                .toList();
    }

    private static URI parseUrl(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new InvalidUrlException("Server URL must not be empty");
        }
        URI uri;
        try {
            uri = new URI(rawUrl.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException("Invalid server URL: " + rawUrl, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new InvalidUrlException("Server URL must use http or https: " + rawUrl);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidUrlException("Server URL has no host: " + rawUrl);
        }
        return uri;
    }

    @Override
    public String toString() {
        return "Pool{id='" + id + "', servers=" + getServers() + '}';
    }
}
