package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.config.BackendConfig;
import com.tollgate.proxy.config.CircuitBreakerConfig;
import com.tollgate.proxy.config.HealthCheckConfig;
import com.tollgate.proxy.config.PoliciesConfig;
import com.tollgate.proxy.config.RouteConfig;
import com.tollgate.proxy.config.ServerConfig;
import com.tollgate.proxy.config.TollgateProperties;
import com.tollgate.proxy.core.backend.HealthMonitor;
import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.cache.ResponseCache;
import com.tollgate.proxy.core.events.EventBus;
import com.tollgate.proxy.core.exceptions.ConfigException;
import com.tollgate.proxy.core.proxy.impl.http.middleware.AuthMiddleware;
import com.tollgate.proxy.core.proxy.impl.http.middleware.CorsMiddleware;
import com.tollgate.proxy.core.proxy.impl.http.middleware.LoggingMiddleware;
import com.tollgate.proxy.core.routing.Route;
import com.tollgate.proxy.core.traffic.CircuitBreaker;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builds a {@link ProxyEngine} from {@link TollgateProperties}.
 * Invalid servers and routes are logged and skipped; the rest of the
 * configuration still applies.
 */
public class ProxyEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(ProxyEngineFactory.class);

    private final MeterRegistry registry;
    private final Consumer<String> accessLog;

    /**
     * Creates a new factory.
     * @param registry  The Micrometer meter registry.
     * @param accessLog Sink of the request logging middleware.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyEngineFactory(MeterRegistry registry, Consumer<String> accessLog) {
        this.registry = registry;
        this.accessLog = accessLog;
    }

    /**
     * Creates an engine and starts the health monitors of its pools.
     * @param properties The configuration.
     * @return The configured engine.
     */
    public ProxyEngine create(TollgateProperties properties) {
        ServerConfig server = properties.getServer();
        BackendForwarder forwarder = new BackendForwarder(
                Duration.ofMillis(server.getConnectTimeoutMs()),
                server.getRequestTimeoutMs() > 0 ? Duration.ofMillis(server.getRequestTimeoutMs()) : null);
        ProxyEngine engine = new ProxyEngine(registry, forwarder, new ResponseCache(), new EventBus());

        Map<String, Pool> pools = new HashMap<>();
        for (BackendConfig backend : orEmpty(properties.getBackends())) {
            Pool pool = buildPool(backend);
            pools.put(pool.getId(), pool);
            engine.addPool(pool);

            HealthCheckConfig hc = backend.getHealthCheck();
            if (hc != null && hc.isEnabled()) {
                HealthMonitor monitor = new HealthMonitor(pool, Duration.ofMillis(hc.getIntervalMs()),
                        Duration.ofMillis(hc.getTimeoutMs()), hc.getPath());
                engine.addHealthMonitor(monitor);
                monitor.start();
            }
        }

        for (RouteConfig routeConfig : orEmpty(properties.getRoutes())) {
            addRoute(engine, routeConfig, pools);
        }

        applyPolicies(engine, properties.getPolicies());
        log.info("Proxy engine configured: {} backends, {} routes", pools.size(),
                engine.getRouter().listRoutes().size());
        return engine;
    }

    private Pool buildPool(BackendConfig backend) {
        Pool pool = new Pool(backend.getId());
        for (String url : orEmpty(backend.getServers())) {
            try {
                pool.addServer(url, 1);
            } catch (ConfigException e) {
                log.warn("Skipping server {} of backend {}: {}", url, backend.getId(), e.getMessage());
            }
        }
        log.info("Backend {} has {} servers", backend.getId(), pool.size());
        return pool;
    }

    private void addRoute(ProxyEngine engine, RouteConfig config, Map<String, Pool> pools) {
        Pool pool = pools.get(config.getBackendId());
        if (pool == null) {
            log.warn("Skipping route {}: backend {} not found", config.getName(), config.getBackendId());
            return;
        }

        Route route = new Route(config.getName(), pool);
        route.setPattern(config.getPattern());
        route.setPrefix(config.getPathPrefix());
        route.setSubdomain(config.getSubdomain());
        route.setHeaders(config.getHeaders());
        route.setMethods(config.getMethods() != null ? new LinkedHashSet<>(config.getMethods()) : null);
        route.setPriority(config.getPriority());

        CircuitBreakerConfig cb = config.getCircuitBreaker();
        if (cb != null && cb.isEnabled()) {
            route.setCircuitBreaker(new CircuitBreaker(config.getName(), cb.getFailureThreshold(),
                    cb.getSuccessThreshold(), Duration.ofMillis(cb.getTimeoutMs())));
        }

        try {
            engine.addRoute(route);
        } catch (ConfigException e) {
            log.warn("Skipping route {}: {}", config.getName(), e.getMessage());
        }
    }

    private void applyPolicies(ProxyEngine engine, PoliciesConfig policies) {
        if (policies.getCors().isEnabled()) {
            engine.addMiddleware(new CorsMiddleware(policies.getCors().getAllowedOrigins()));
        }
        if (policies.getAuth().isEnabled()) {
            engine.addMiddleware(new AuthMiddleware(AuthMiddleware.sharedSecret(policies.getAuth().getSecret())));
        }
        engine.addMiddleware(new LoggingMiddleware(accessLog));

        if (policies.getRateLimit().isEnabled()) {
            engine.setRateLimit(policies.getRateLimit().getMaxRequests(),
                    Duration.ofMillis(policies.getRateLimit().getWindowMs()));
        }
        if (policies.getCache().isEnabled()) {
            engine.enableCache(Duration.ofMillis(policies.getCache().getTtlMs()), policies.getCache().getMethods());
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
