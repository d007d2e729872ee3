package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.core.backend.Server;
import com.tollgate.proxy.core.constants.HeaderConstants;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sends a request to a chosen backend server and returns the streaming response.
 */
public class BackendForwarder {

    /** Headers that should not be forwarded from client to backend. */
    private static final Set<String> DISALLOWED_HEADERS;

    /** Hop-by-hop headers that must be removed per RFC 2616. */
    private static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        Set<String> hopByHop = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        hopByHop.addAll(List.of(
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILERS.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue()));
        HOP_BY_HOP_HEADERS = Collections.unmodifiableSet(hopByHop);

        Set<String> disallowed = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        disallowed.addAll(hopByHop);
        // Set by the HTTP client itself
        disallowed.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.EXPECT.getValue(),
                "Date"));
        disallowed.addAll(List.of(
                HeaderConstants.X_FORWARDED_FOR.getValue(),
                HeaderConstants.X_FORWARDED_PROTO.getValue(),
                HeaderConstants.X_REAL_IP.getValue()));
        DISALLOWED_HEADERS = Collections.unmodifiableSet(disallowed);
    }

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * @param connectTimeout timeout for connecting to a backend.
     * @param requestTimeout timeout until response headers arrive; null for none.
     */
    public BackendForwarder(Duration connectTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.requestTimeout = requestTimeout;
    }

    /**
     * Forwards the request to the server, keeping the path and query.
     *
     * @param context the inbound request.
     * @param server  the target server.
     * @return the backend response with a streaming body.
     * @throws IOException          if the backend cannot be reached.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public HttpResponse<InputStream> forward(RequestContext context, Server server)
            throws IOException, InterruptedException {
        HttpRequest.BodyPublisher body = context.getBody().length > 0
                ? HttpRequest.BodyPublishers.ofByteArray(context.getBody())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest request;
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder()
                    .uri(targetUri(server, context))
                    .version(HttpClient.Version.HTTP_1_1)
                    .method(context.getMethod(), body);
            if (requestTimeout != null) {
                rb.timeout(requestTimeout);
            }
            forwardedHeaders(context).forEach(rb::header);
            request = rb.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Request rejected by HTTP client: " + e.getMessage(), e);
        }
        return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Computes the headers sent to the backend: the client's headers minus
     * hop-by-hop ones, plus X-Forwarded-For, X-Forwarded-Proto and X-Real-IP.
     *
     * @param context the inbound request.
     * @return outbound headers.
     */
    static Map<String, String> forwardedHeaders(RequestContext context) {
        Map<String, String> out = new LinkedHashMap<>();
        context.getHeaders().forEach((k, v) -> {
            if (!DISALLOWED_HEADERS.contains(k)) {
                out.put(k, v);
            }
        });

        // Standard mod_proxy-style X-Forwarded headers
        String existingXff = context.getHeader(HeaderConstants.X_FORWARDED_FOR.getValue());
        String xff = (existingXff != null && !existingXff.isBlank() ? existingXff + ", " : "")
                + context.getRemoteAddr();
        out.put(HeaderConstants.X_FORWARDED_FOR.getValue(), xff);

        String proto = context.getHeader(HeaderConstants.X_FORWARDED_PROTO.getValue());
        out.put(HeaderConstants.X_FORWARDED_PROTO.getValue(), proto != null && !proto.isEmpty() ? proto : "http");
        out.put(HeaderConstants.X_REAL_IP.getValue(), context.getClientIp());
        return out;
    }

    /**
     * Copies response headers for the client, dropping hop-by-hop ones.
     *
     * @param headers backend response headers.
     * @return headers to send to the client.
     */
    static Map<String, List<String>> responseHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (!k.startsWith(":") && !HOP_BY_HOP_HEADERS.contains(k)) {
                out.put(k, v);
            }
        });
        return out;
    }

    static URI targetUri(Server server, RequestContext context) {
        String base = server.getUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String query = context.getQuery();
        return URI.create(base + context.getPath() + (query != null ? "?" + query : ""));
    }
}
