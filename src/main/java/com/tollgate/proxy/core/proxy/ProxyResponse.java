package com.tollgate.proxy.core.proxy;

import com.tollgate.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response produced by the engine: a status, a header multimap and a body
 * stream. Bodies of forwarded responses stream straight from the backend, so
 * callers must {@link #close()} the response once written.
 */
public class ProxyResponse implements Closeable {

    private final int status;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final InputStream body;
    private final long contentLength;

    /**
     * Creates a response.
     *
     * @param status        HTTP status.
     * @param headers       Response headers.
     * @param body          Body stream.
     * @param contentLength Body length in bytes, or -1 if unknown.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyResponse(int status, Map<String, List<String>> headers, InputStream body, long contentLength) {
        this.status = status;
        if (headers != null) {
            headers.forEach((k, v) -> this.headers.put(k, new ArrayList<>(v)));
        }
        this.body = body != null ? body : InputStream.nullInputStream();
        this.contentLength = contentLength;
    }

    /**
     * Creates a fully buffered response.
     *
     * @param status  HTTP status.
     * @param headers Response headers.
     * @param body    Body bytes.
     * @return the response.
     */
    public static ProxyResponse of(int status, Map<String, List<String>> headers, byte[] body) {
        byte[] bytes = body != null ? body : new byte[0];
        return new ProxyResponse(status, headers, new ByteArrayInputStream(bytes), bytes.length);
    }

    /**
     * Creates a plain-text error response.
     *
     * @param status  HTTP status.
     * @param message Body text.
     * @return the response.
     */
    public static ProxyResponse error(int status, String message) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", List.of("text/plain; charset=utf-8"));
        return of(status, headers, (message + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public int getStatus() {
        return status;
    }

    public Map<String, List<String>> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * First value of a header.
     *
     * @param name header name.
     * @return the value, or null.
     */
    public String getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Replaces a header.
     *
     * @param name  header name.
     * @param value header value.
     * @return this response.
     */
    public ProxyResponse setHeader(String name, String value) {
        List<String> values = new ArrayList<>();
        values.add(value);
        headers.put(name, values);
        return this;
    }

    /**
     * Applies headers queued by middlewares.
     *
     * @param extra headers to merge; they replace same-named headers.
     * @return this response.
     */
    public ProxyResponse withHeaders(Map<String, List<String>> extra) {
        extra.forEach((k, v) -> headers.put(k, new ArrayList<>(v)));
        return this;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getBody() {
        return body;
    }

    public long getContentLength() {
        return contentLength;
    }

    /**
     * Reads the remaining body. Intended for buffered responses and tests.
     *
     * @return body bytes.
     * @throws IOException if the stream fails.
     */
    public byte[] readBody() throws IOException {
        try (InputStream in = body) {
            return in.readAllBytes();
        }
    }

    /**
     * Reads the remaining body as UTF-8 text.
     *
     * @return body text.
     * @throws IOException if the stream fails.
     */
    public String readBodyAsString() throws IOException {
        return new String(readBody(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        IoUtils.closeQuietly(body, "response body");
    }
}
