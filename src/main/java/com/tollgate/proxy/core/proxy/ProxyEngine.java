package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.core.backend.HealthMonitor;
import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.backend.Server;
import com.tollgate.proxy.core.cache.CacheEntry;
import com.tollgate.proxy.core.cache.ResponseCache;
import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.constants.ProxyEventType;
import com.tollgate.proxy.core.events.EventBus;
import com.tollgate.proxy.core.events.ProxyEvent;
import com.tollgate.proxy.core.exceptions.CircuitOpenException;
import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.impl.http.middleware.Middleware;
import com.tollgate.proxy.core.proxy.impl.http.middleware.MiddlewareChain;
import com.tollgate.proxy.core.ratelimit.RateLimiter;
import com.tollgate.proxy.core.routing.Route;
import com.tollgate.proxy.core.routing.Router;
import com.tollgate.proxy.core.traffic.CircuitBreaker;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * The reverse proxy pipeline.
 *
 * <p>
 * Each request runs through: rate limit, middleware chain, route match,
 * backend selection, cache lookup and forwarding. The first failing step
 * decides the response (429, the middleware's status, 404, 503 or 502) and
 * emits the matching event. The engine holds no lock across backend I/O.
 * </p>
 */
public class ProxyEngine {

    private static final Logger log = LoggerFactory.getLogger(ProxyEngine.class);

    /** Limit applied until {@link #setRateLimit} is called. */
    public static final int DEFAULT_MAX_REQUESTS = 1000;
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    private static final String CACHE_HIT = "HIT";
    private static final String CACHE_MISS = "MISS";

    private final Router router = new Router();
    private final MiddlewareChain middlewares = new MiddlewareChain();
    private final ResponseCache cache;
    private final EventBus events;
    private final BackendForwarder forwarder;
    private final Map<String, Pool> pools = new ConcurrentHashMap<>();
    private final List<HealthMonitor> monitors = new CopyOnWriteArrayList<>();

    private volatile RateLimiter rateLimiter = new RateLimiter(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW);
    private volatile Duration cacheTtl;
    private volatile Set<String> cacheableMethods = Set.of();

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private final Counter requestsTotal;
    private final Counter cacheHits;
    private final Map<String, Counter> rejected = new ConcurrentHashMap<>();
    private final MeterRegistry registry;

    public ProxyEngine() {
        this(new SimpleMeterRegistry());
    }

    public ProxyEngine(MeterRegistry registry) {
        this(registry, new BackendForwarder(Duration.ofSeconds(5), Duration.ofSeconds(30)), new ResponseCache(),
                new EventBus());
    }

    /**
     * Creates an engine with explicit collaborators.
     *
     * @param registry  meter registry for proxy metrics.
     * @param forwarder outbound HTTP forwarder.
     * @param cache     response cache.
     * @param events    event dispatcher.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyEngine(MeterRegistry registry, BackendForwarder forwarder, ResponseCache cache, EventBus events) {
        this.registry = registry;
        this.forwarder = forwarder;
        this.cache = cache;
        this.events = events;
        this.requestsTotal = registry.counter("proxy.requests.total");
        this.cacheHits = registry.counter("proxy.cache.hits");
        Gauge.builder("proxy.cache.entries", cache, ResponseCache::size).register(registry);
    }

    /**
     * Runs one request through the pipeline.
     *
     * @param context the request.
     * @return the response; the caller must close it once written.
     */
    public ProxyResponse handle(RequestContext context) {
        requestCount.incrementAndGet();
        requestsTotal.increment();

        ProxyResponse response = process(context);
        response.withHeaders(context.getResponseHeaders());
        if (response.getStatus() >= 400) {
            errorCount.incrementAndGet();
        }
        return response;
    }

    private ProxyResponse process(RequestContext context) {
        RateLimiter limiter = rateLimiter;
        if (limiter != null && !limiter.allow(context.getRemoteAddr())) {
            emit(ProxyEvent.of(ProxyEventType.RATE_LIMIT_EXCEEDED, context));
            reject("rate_limited");
            return ProxyResponse.error(429, "Rate limit exceeded");
        }

        ProxyResponse response = runMiddlewares(context);
        middlewares.complete(context, response.getStatus());
        return response;
    }

    private ProxyResponse runMiddlewares(RequestContext context) {
        try {
            ProxyResponse early = middlewares.execute(context);
            if (early != null) {
                return early;
            }
        } catch (MiddlewareException e) {
            emit(ProxyEvent.of(ProxyEventType.MIDDLEWARE_ERROR, context, null, e));
            reject("middleware");
            log.debug("Middleware rejected {} {}: {}", context.getMethod(), context.getPath(), e.getMessage());
            return ProxyResponse.error(e.getStatus(), e.getMessage());
        } catch (RuntimeException e) {
            emit(ProxyEvent.of(ProxyEventType.MIDDLEWARE_ERROR, context, null, e));
            reject("middleware");
            log.warn("Middleware failed on {} {}: {}", context.getMethod(), context.getPath(), e.toString());
            return ProxyResponse.error(MiddlewareException.DEFAULT_STATUS, "Forbidden");
        }
        return route(context);
    }

    private ProxyResponse route(RequestContext context) {
        Route route = router.match(context);
        if (route == null) {
            emit(ProxyEvent.of(ProxyEventType.NO_ROUTE_FOUND, context));
            reject("no_route");
            return ProxyResponse.error(404, "Not Found");
        }

        Pool pool = route.resolvePool(context);
        Server server = pool != null ? pool.getServer() : null;
        if (server == null) {
            emit(ProxyEvent.of(ProxyEventType.NO_BACKEND_AVAILABLE, context));
            reject("no_backend");
            return ProxyResponse.error(503, "Service Unavailable");
        }

        String cacheKey = ResponseCache.key(context.getMethod(), context.getPath(), server);
        CacheEntry cached = cache.get(cacheKey);
        if (cached != null) {
            cacheHits.increment();
            emit(ProxyEvent.of(ProxyEventType.CACHE_HIT, context, server, null));
            return ProxyResponse.of(cached.getStatus(), cached.getHeaders(), cached.getBody())
                    .setHeader(HeaderConstants.X_CACHE.getValue(), CACHE_HIT);
        }

        return forward(context, route, server, cacheKey);
    }

    private ProxyResponse forward(RequestContext context, Route route, Server server, String cacheKey) {
        CircuitBreaker breaker = route.getCircuitBreaker();
        if (breaker != null) {
            try {
                breaker.acquire();
            } catch (CircuitOpenException e) {
                emit(ProxyEvent.of(ProxyEventType.CIRCUIT_OPEN, context, server, e));
                reject("circuit_open");
                return ProxyResponse.error(503, "Service Unavailable");
            }
        }

        emit(ProxyEvent.of(ProxyEventType.REQUEST_FORWARDED, context, server, null));

        HttpResponse<InputStream> upstream;
        try {
            upstream = forwarder.forward(context, server);
        } catch (IOException e) {
            return badGateway(context, server, breaker, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return badGateway(context, server, breaker, e);
        }

        if (breaker != null) {
            if (upstream.statusCode() >= 500) {
                breaker.recordFailure();
            } else {
                breaker.recordSuccess();
            }
        }

        Map<String, List<String>> headers = BackendForwarder.responseHeaders(upstream.headers().map());
        boolean cacheable = isCacheable(context.getMethod());
        if (cacheable && upstream.statusCode() == 200) {
            byte[] body;
            try (InputStream in = upstream.body()) {
                body = in.readAllBytes();
            } catch (IOException e) {
                return badGateway(context, server, null, e);
            }
            cache.put(cacheKey, upstream.statusCode(), headers, body, cacheTtl);
            return ProxyResponse.of(upstream.statusCode(), headers, body)
                    .setHeader(HeaderConstants.X_CACHE.getValue(), CACHE_MISS);
        }

        long length = upstream.headers().firstValueAsLong(HeaderConstants.CONTENT_LENGTH.getValue()).orElse(-1L);
        ProxyResponse response = new ProxyResponse(upstream.statusCode(), headers, upstream.body(), length);
        if (cacheable) {
            response.setHeader(HeaderConstants.X_CACHE.getValue(), CACHE_MISS);
        }
        return response;
    }

    private ProxyResponse badGateway(RequestContext context, Server server, CircuitBreaker breaker, Exception e) {
        if (breaker != null) {
            breaker.recordFailure();
        }
        log.warn("Forwarding {} {} to {} failed: {}", context.getMethod(), context.getPath(), server,
                e.getMessage());
        emit(ProxyEvent.of(ProxyEventType.PROXY_ERROR, context, server, e));
        reject("bad_gateway");
        return ProxyResponse.error(502, "Bad Gateway: " + e.getMessage());
    }

    private boolean isCacheable(String method) {
        return cacheTtl != null && cacheableMethods.contains(method);
    }

    private void reject(String reason) {
        rejected.computeIfAbsent(reason, r -> Counter.builder("proxy.requests.rejected")
                .tag("reason", r)
                .register(registry)).increment();
    }

    private void emit(ProxyEvent event) {
        events.emit(event);
    }

    /**
     * Adds a route.
     *
     * @param route the route.
     * @throws com.tollgate.proxy.core.exceptions.InvalidPatternException if its pattern does not compile.
     */
    public void addRoute(Route route) {
        router.addRoute(route);
    }

    public ProxyEngine addMiddleware(Middleware middleware) {
        middlewares.add(middleware);
        return this;
    }

    /**
     * Replaces the rate limiter. Existing buckets are discarded.
     *
     * @param maxRequests bucket capacity per client.
     * @param window      refill window.
     */
    public void setRateLimit(int maxRequests, Duration window) {
        this.rateLimiter = new RateLimiter(maxRequests, window);
    }

    /**
     * Turns on cache fill for successful responses to the given methods.
     *
     * @param ttl     entry lifetime.
     * @param methods cacheable methods; GET if empty.
     */
    public void enableCache(Duration ttl, Collection<String> methods) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (methods == null || methods.isEmpty()) {
            set.add("GET");
        } else {
            set.addAll(methods);
        }
        this.cacheableMethods = set;
        this.cacheTtl = ttl;
    }

    /**
     * Stores a response for the request as if it had come from the server.
     *
     * @param context request the entry answers.
     * @param server  server the entry is bound to.
     * @param status  HTTP status.
     * @param headers response headers.
     * @param body    body bytes.
     * @param ttl     entry lifetime.
     */
    public void cacheResponse(RequestContext context, Server server, int status, Map<String, List<String>> headers,
            byte[] body, Duration ttl) {
        cache.put(ResponseCache.key(context.getMethod(), context.getPath(), server), status, headers, body, ttl);
    }

    public void clearCache() {
        cache.clear();
        log.info("Response cache cleared");
    }

    /**
     * Subscribes to an event type, e.g. {@code "proxy_error"}.
     *
     * @param eventType event type wire name.
     * @param handler   handler run asynchronously per event.
     */
    public void on(String eventType, Consumer<ProxyEvent> handler) {
        events.on(eventType, handler);
    }

    public ProxyStats getStats() {
        return new ProxyStats(requestCount.get(), errorCount.get(), cache.size());
    }

    public void addPool(Pool pool) {
        pools.put(pool.getId(), pool);
    }

    public Pool getPool(String id) {
        return pools.get(id);
    }

    public Collection<Pool> getPools() {
        return List.copyOf(pools.values());
    }

    public void addHealthMonitor(HealthMonitor monitor) {
        monitors.add(monitor);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public Router getRouter() {
        return router;
    }

    /**
     * Stops health monitors and the event dispatcher.
     */
    public void shutdown() {
        monitors.forEach(HealthMonitor::stop);
        events.shutdown();
    }
}
