package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.proxy.RequestContext;

/**
 * Sticky bucketing helpers shared by the A/B and blue-green managers.
 */
public final class RoutingKeys {

    /** Cookie consulted when no user header is present. */
    public static final String USER_COOKIE = "user_id";

    private RoutingKeys() {
    }

    /**
     * The identifier a request is bucketed by: {@code X-User-ID}, then the
     * {@code user_id} cookie, then the empty string.
     *
     * @param request the request.
     * @return the identifier, never null.
     */
    public static String identifier(RequestContext request) {
        String userId = request.getHeader(HeaderConstants.X_USER_ID.getValue());
        if (userId != null && !userId.isEmpty()) {
            return userId;
        }
        String cookie = request.getCookie(USER_COOKIE);
        return cookie != null ? cookie : "";
    }

    /**
     * Base-31 polynomial hash over the string's code points, folded to
     * non-negative. Wraps on overflow.
     *
     * @param s input.
     * @return a non-negative hash.
     */
    public static long hash(String s) {
        long hash = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            hash = hash * 31 + cp;
            i += Character.charCount(cp);
        }
        if (hash < 0) {
            hash = -hash;
        }
        // -Long.MIN_VALUE is still negative
        return hash < 0 ? 0 : hash;
    }

    /**
     * @param request the request.
     * @return the request's bucket in [0, 100).
     */
    public static int bucket(RequestContext request) {
        return (int) (hash(identifier(request)) % 100);
    }
}
