package com.tollgate.proxy.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tollgate.proxy.config.AdminConfig;
import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.backend.Server;
import com.tollgate.proxy.core.proxy.ProxyEngine;
import com.tollgate.proxy.core.proxy.ProxyStats;
import com.tollgate.proxy.core.utils.DaemonThreadFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server ({@code /health}, {@code /metrics}, {@code /stats}, {@code /cache/clear}).
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(AdminConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = config;
    }

    /**
     * Starts the admin server if enabled.
     *
     * @param engine engine whose stats and cache the admin endpoints expose.
     */
    public void start(ProxyEngine engine) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            adminServer.createContext("/health", exchange -> send(exchange, 200, "text/plain", "OK"));

            // Prometheus exposition format
            adminServer.createContext("/metrics", exchange -> send(exchange, 200,
                    "text/plain; version=0.0.4; charset=utf-8", registry.scrape()));

            adminServer.createContext("/stats", exchange -> send(exchange, 200, "application/json",
                    statsJson(engine)));

            adminServer.createContext("/cache/clear", exchange -> {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "POST");
                    send(exchange, 405, "text/plain", "Method Not Allowed");
                    return;
                }
                engine.clearCache();
                send(exchange, 200, "text/plain", "Cache cleared");
            });

            adminExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("admin"));
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics, /stats, /cache/clear)", getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
        }
    }

    private static void send(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String statsJson(ProxyEngine engine) {
        ProxyStats stats = engine.getStats();
        StringBuilder json = new StringBuilder()
                .append("{\"requestCount\":").append(stats.requestCount())
                .append(",\"errorCount\":").append(stats.errorCount())
                .append(",\"cacheSize\":").append(stats.cacheSize())
                .append(",\"pools\":{");
        boolean firstPool = true;
        for (Pool pool : engine.getPools()) {
            if (!firstPool) {
                json.append(',');
            }
            firstPool = false;
            json.append('"').append(escape(pool.getId())).append("\":[");
            boolean firstServer = true;
            for (Server server : pool.getServers()) {
                if (!firstServer) {
                    json.append(',');
                }
                firstServer = false;
                json.append("{\"url\":\"").append(escape(server.getUrl().toString()))
                        .append("\",\"healthy\":").append(server.isHealthy()).append('}');
            }
            json.append(']');
        }
        return json.append("}}").toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * @return the bound admin port, or -1 if not running.
     */
    public int getPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
