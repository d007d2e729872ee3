package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.util.List;
import java.util.Map;

/**
 * Adds CORS headers for allowed origins and answers preflight requests.
 */
public class CorsMiddleware implements Middleware {

    static final String ALLOWED_METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    static final String ALLOWED_HEADERS = "Content-Type, Authorization";

    private final List<String> allowedOrigins;

    /**
     * @param allowedOrigins exact origins, or {@code "*"} for any.
     */
    public CorsMiddleware(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of();
    }

    @Override
    public ProxyResponse preHandle(RequestContext context) {
        String origin = context.getHeader(HeaderConstants.ORIGIN.getValue());
        if (origin != null && isAllowed(origin)) {
            context.setResponseHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_ORIGIN.getValue(), origin);
            context.setResponseHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_METHODS.getValue(), ALLOWED_METHODS);
            context.setResponseHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_HEADERS.getValue(), ALLOWED_HEADERS);
        }
        if ("OPTIONS".equals(context.getMethod())) {
            return ProxyResponse.of(200, Map.of(), new byte[0]);
        }
        return null;
    }

    private boolean isAllowed(String origin) {
        for (String allowed : allowedOrigins) {
            if ("*".equals(allowed) || allowed.equals(origin)) {
                return true;
            }
        }
        return false;
    }
}
