package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.function.Predicate;

/**
 * Token check on the {@code Authorization} header. A missing token is
 * answered with 401, a rejected one with 403.
 */
public class AuthMiddleware implements Middleware {

    private static final String BEARER_PREFIX = "Bearer ";

    private final Predicate<String> validator;

    public AuthMiddleware(Predicate<String> validator) {
        this.validator = validator;
    }

    /**
     * Builds a validator for a shared secret. The header must carry the secret
     * either bare or as a bearer token. A blank secret accepts any token.
     *
     * @param secret the shared secret.
     * @return the validator.
     */
    public static Predicate<String> sharedSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            return token -> !token.isEmpty();
        }
        byte[] expected = secret.getBytes(StandardCharsets.UTF_8);
        return token -> {
            String value = token.startsWith(BEARER_PREFIX) ? token.substring(BEARER_PREFIX.length()) : token;
            return MessageDigest.isEqual(expected, value.getBytes(StandardCharsets.UTF_8));
        };
    }

    @Override
    public ProxyResponse preHandle(RequestContext context) throws MiddlewareException {
        String token = context.getHeader(HeaderConstants.AUTHORIZATION.getValue());
        if (token == null || token.isEmpty()) {
            throw new MiddlewareException(401, "Unauthorized");
        }
        if (!validator.test(token)) {
            throw new MiddlewareException(403, "Forbidden");
        }
        return null;
    }
}
