package com.tollgate.proxy.core.routing;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.util.Map;

/**
 * Selects a pool by the exact Content-Type of a request.
 */
public class ContentTypeRouter {

    /**
     * @param request the request.
     * @param mapping content type to pool.
     * @return the mapped pool, or null if the content type is absent or unmapped.
     */
    public Pool route(RequestContext request, Map<String, Pool> mapping) {
        String contentType = request.getHeader(HeaderConstants.CONTENT_TYPE.getValue());
        if (contentType == null || mapping == null) {
            return null;
        }
        return mapping.get(contentType);
    }
}
