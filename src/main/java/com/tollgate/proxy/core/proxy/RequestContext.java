package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.core.constants.HeaderConstants;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Context for a single HTTP request passing through the proxy pipeline.
 * Request headers are case-insensitive and single-valued. Middlewares may add
 * response headers that are applied to whatever response the engine produces.
 */
public class RequestContext {

    private static final byte[] EMPTY = new byte[0];

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final String remoteAddr;
    private final byte[] body;
    private final Map<String, List<String>> responseHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private volatile String user;
    private volatile long bytes;
    private volatile long startNanos;

    /**
     * Creates a context without a body.
     *
     * @param method     HTTP method.
     * @param uri        Absolute request URI.
     * @param headers    Request headers.
     * @param remoteAddr Transport-level address of the client.
     */
    public RequestContext(String method, URI uri, Map<String, String> headers, String remoteAddr) {
        this(method, uri, headers, remoteAddr, EMPTY);
    }

    /**
     * Creates a context.
     *
     * @param method     HTTP method.
     * @param uri        Absolute request URI.
     * @param headers    Request headers.
     * @param remoteAddr Transport-level address of the client.
     * @param body       Request body, possibly empty.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RequestContext(String method, URI uri, Map<String, String> headers, String remoteAddr, byte[] body) {
        this.method = method;
        this.uri = uri;
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            this.headers.putAll(headers);
        }
        this.remoteAddr = remoteAddr;
        this.body = body != null ? body : EMPTY;
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public String getPath() {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    public String getQuery() {
        return uri.getRawQuery();
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * The Host the client addressed, port included if it sent one.
     *
     * @return the Host header, falling back to the URI authority.
     */
    public String getHost() {
        String host = headers.get(HeaderConstants.HOST.getValue());
        if (host != null && !host.isEmpty()) {
            return host;
        }
        return uri.getAuthority() != null ? uri.getAuthority() : "";
    }

    /**
     * Looks up a cookie from the {@code Cookie} header.
     *
     * @param name cookie name.
     * @return the cookie value, or null if absent.
     */
    public String getCookie(String name) {
        String cookieHeader = headers.get(HeaderConstants.COOKIE.getValue());
        if (cookieHeader == null) {
            return null;
        }
        for (String pair : cookieHeader.split(";")) {
            int idx = pair.indexOf('=');
            if (idx > 0 && pair.substring(0, idx).trim().equals(name)) {
                return pair.substring(idx + 1).trim();
            }
        }
        return null;
    }

    /**
     * Resolves the originating client address.
     * Precedence: first entry of X-Forwarded-For, then X-Real-IP, then the
     * transport address.
     *
     * @return the client IP.
     */
    public String getClientIp() {
        String xff = headers.get(HeaderConstants.X_FORWARDED_FOR.getValue());
        if (xff != null && !xff.isBlank()) {
            String first = xff.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = headers.get(HeaderConstants.X_REAL_IP.getValue());
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return remoteAddr;
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public long getBytes() {
        return bytes;
    }

    public void setBytes(long bytes) {
        this.bytes = bytes;
    }

    /**
     * @return the {@link System#nanoTime()} mark set when handling started, or 0 if unset.
     */
    public long getStartNanos() {
        return startNanos;
    }

    public void setStartNanos(long startNanos) {
        this.startNanos = startNanos;
    }

    /**
     * Sets a header on the eventual response, replacing earlier values.
     *
     * @param name  header name.
     * @param value header value.
     */
    public synchronized void setResponseHeader(String name, String value) {
        List<String> values = new ArrayList<>();
        values.add(value);
        responseHeaders.put(name, values);
    }

    public synchronized Map<String, List<String>> getResponseHeaders() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        responseHeaders.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }
}
