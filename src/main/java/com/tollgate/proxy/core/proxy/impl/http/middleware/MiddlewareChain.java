package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of middlewares. Execution stops at the first one that throws
 * or answers the request itself.
 */
public class MiddlewareChain {

    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();

    public MiddlewareChain add(Middleware middleware) {
        middlewares.add(middleware);
        return this;
    }

    /**
     * @param context the request.
     * @return the first short-circuit response, or null if every middleware passed.
     * @throws MiddlewareException from the first middleware that rejected the request.
     */
    public ProxyResponse execute(RequestContext context) throws MiddlewareException {
        for (Middleware middleware : middlewares) {
            ProxyResponse response = middleware.preHandle(context);
            if (response != null) {
                return response;
            }
        }
        return null;
    }

    /**
     * Runs every middleware's post-handler.
     *
     * @param context    the request.
     * @param statusCode the status sent to the client.
     */
    public void complete(RequestContext context, int statusCode) {
        for (Middleware middleware : middlewares) {
            middleware.postHandle(context, statusCode);
        }
    }

    public int size() {
        return middlewares.size();
    }
}
