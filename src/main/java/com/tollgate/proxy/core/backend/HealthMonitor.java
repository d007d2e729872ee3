package com.tollgate.proxy.core.backend;

import com.tollgate.proxy.core.utils.DaemonThreadFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background prober for one {@link Pool}.
 * On every tick it sends one GET per registered server to
 * {@code baseUrl + path}. A 200 marks the server healthy; any other status,
 * error or timeout marks it unhealthy.
 *
 * <p>
 * Probes are asynchronous and independent of each other and of the tick
 * loop. Overlapping probes for the same server are tolerated, the last one
 * to complete wins.
 * </p>
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    /** Path probed when none is configured. */
    public static final String DEFAULT_PATH = "/health";
    /** Default interval between ticks. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    /** Default timeout for each probe. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final int HTTP_OK = 200;

    private final Pool pool;
    private final Duration interval;
    private final Duration timeout;
    private final String path;
    private final HttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * Creates a monitor for the given pool.
     *
     * @param pool     The pool whose servers are probed.
     * @param interval Time between ticks.
     * @param timeout  Timeout of each probe.
     * @param path     Health path; {@code /health} if null or empty.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HealthMonitor(Pool pool, Duration interval, Duration timeout, String path) {
        this.pool = pool;
        this.interval = interval != null ? interval : DEFAULT_INTERVAL;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.path = normalizePath(path);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("health-" + pool.getId()));
    }

    /**
     * Schedules the periodic ticks. The first tick fires one interval from now.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::checkHealth, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Health monitor started for pool {} (path: {}, interval: {} ms)", pool.getId(), path, millis);
    }

    /**
     * Stops future ticks. Probes already in flight are not awaited.
     */
    public void stop() {
        scheduler.shutdownNow();
        log.info("Health monitor stopped for pool {}", pool.getId());
    }

    /**
     * Fires one probe per currently-registered server and returns immediately.
     */
    public void checkHealth() {
        for (Server server : pool.getServers()) {
            probe(server);
        }
    }

    private void probe(Server server) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(healthUrl(server)))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Health check URL invalid for {}: {}", server, e.getMessage());
            update(server, false);
            return;
        }

        httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        log.debug("Health check error for {}: {}", server, error.getMessage());
                        update(server, false);
                    } else {
                        if (response.statusCode() != HTTP_OK) {
                            log.debug("Health check for {} returned {}", server, response.statusCode());
                        }
                        update(server, response.statusCode() == HTTP_OK);
                    }
                });
    }

    private void update(Server server, boolean healthy) {
        boolean previous = pool.setHealth(server, healthy);
        if (previous && !healthy) {
            log.warn("Server {} in pool {} marked unhealthy", server, pool.getId());
        } else if (!previous && healthy) {
            log.info("Server {} in pool {} recovered", server, pool.getId());
        }
    }

    private String healthUrl(Server server) {
        String base = server.getUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return DEFAULT_PATH;
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    public String getPath() {
        return path;
    }

    public Duration getInterval() {
        return interval;
    }
}
