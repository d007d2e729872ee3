package com.tollgate.proxy.core.events;

import com.tollgate.proxy.core.backend.Server;
import com.tollgate.proxy.core.constants.ProxyEventType;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.time.Instant;

/**
 * A lifecycle notification from the proxy engine.
 *
 * @param type      event type wire name, e.g. {@code "cache_hit"}.
 * @param timestamp when the event occurred.
 * @param request   the request concerned.
 * @param server    the chosen backend, if one was chosen.
 * @param error     the failure, for error events.
 */
public record ProxyEvent(String type, Instant timestamp, RequestContext request, Server server, Throwable error) {

    public static ProxyEvent of(ProxyEventType type, RequestContext request) {
        return new ProxyEvent(type.getValue(), Instant.now(), request, null, null);
    }

    public static ProxyEvent of(ProxyEventType type, RequestContext request, Server server, Throwable error) {
        return new ProxyEvent(type.getValue(), Instant.now(), request, server, error);
    }
}
