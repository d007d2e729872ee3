package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;

/**
 * Pre-routing request handler run by the engine in registration order.
 */
public interface Middleware {

    /**
     * Called before the request is routed.
     *
     * @param context the request.
     * @return null to continue, or a response that ends the pipeline.
     * @throws MiddlewareException to reject the request.
     */
    ProxyResponse preHandle(RequestContext context) throws MiddlewareException;

    /**
     * Called once the engine has a response for the request.
     *
     * @param context    the request.
     * @param statusCode the status sent to the client.
     */
    default void postHandle(RequestContext context, int statusCode) {
    }
}
