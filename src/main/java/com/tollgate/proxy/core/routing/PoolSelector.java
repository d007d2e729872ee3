package com.tollgate.proxy.core.routing;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;

/**
 * Chooses the pool for a request at dispatch time instead of a route's fixed pool.
 */
@FunctionalInterface
public interface PoolSelector {

    /**
     * @param request the current request.
     * @return the pool to use, or null if none applies.
     */
    Pool select(RequestContext request);
}
