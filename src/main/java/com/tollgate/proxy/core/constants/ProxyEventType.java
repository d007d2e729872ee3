package com.tollgate.proxy.core.constants;

/**
 * Lifecycle events emitted by the proxy engine.
 * Subscribers register against the wire name (e.g. {@code "cache_hit"}).
 */
public enum ProxyEventType {
    /** The client exceeded its request budget. */
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    /** A middleware aborted the request. */
    MIDDLEWARE_ERROR("middleware_error"),
    /** No route matched the request. */
    NO_ROUTE_FOUND("no_route_found"),
    /** The matched pool had no healthy server. */
    NO_BACKEND_AVAILABLE("no_backend_available"),
    /** The response was served from the cache. */
    CACHE_HIT("cache_hit"),
    /** The request is being sent to a backend. */
    REQUEST_FORWARDED("request_forwarded"),
    /** The backend could not be reached. */
    PROXY_ERROR("proxy_error"),
    /** The route's circuit breaker rejected the request. */
    CIRCUIT_OPEN("circuit_open");

    private final String value;

    ProxyEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
