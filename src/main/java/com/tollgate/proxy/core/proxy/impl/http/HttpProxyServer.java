package com.tollgate.proxy.core.proxy.impl.http;

import com.tollgate.proxy.config.ServerConfig;
import com.tollgate.proxy.core.constants.HeaderConstants;
import com.tollgate.proxy.core.exceptions.ProtocolException;
import com.tollgate.proxy.core.proxy.ProxyEngine;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.ProxyServer;
import com.tollgate.proxy.core.proxy.RequestContext;
import com.tollgate.proxy.core.utils.DaemonThreadFactory;
import com.tollgate.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP/1.1 front end. Accepts connections, parses requests, hands each one to
 * the {@link ProxyEngine} and writes the response back. Connections are kept
 * alive unless the client asks otherwise. A response of unknown length is sent
 * chunked to HTTP/1.1 clients and delimited by closing the connection for
 * HTTP/1.0 clients.
 */
public class HttpProxyServer implements ProxyServer {

    private static final Logger log = LoggerFactory.getLogger(HttpProxyServer.class);

    private static final int MAX_HTTP_HEADERS = 100;
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024;
    private static final int DEFAULT_SO_TIMEOUT = 60000;

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"), Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(413, "Payload Too Large"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final ServerConfig config;
    private final ProxyEngine engine;
    private final MeterRegistry registry;
    private final ExecutorService executor;
    private final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();
    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /**
     * Latch released once the server socket bind has completed, successfully or not.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess;
    private volatile ServerSocket serverSocket;

    /**
     * Creates the front end.
     *
     * @param config   listener configuration.
     * @param engine   the engine requests are handed to.
     * @param registry meter registry for connection metrics.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HttpProxyServer(ServerConfig config, ProxyEngine engine, MeterRegistry registry) {
        this.config = config;
        this.engine = engine;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("http-conn"));

        this.totalConnections = Counter.builder("proxy.connections.total")
                .description("Total number of accepted connections")
                .register(registry);
        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .description("Total number of connection errors")
                .register(registry);
        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds the configured port and runs the accept loop until {@link #stop()}.
     */
    @Override
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            bindSuccess = true;
            bindLatch.countDown();
            log.info("HTTP front end started on {}:{}", config.getHost(), getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("HTTP server error on port {}: {}", config.getPort(), e.getMessage(), e);
        }
    }

    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("Accept error on port {}: {}", config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("I/O error during accept on port {}: {}", config.getPort(), e.getMessage());
            return true;
        }
    }

    private void processClient(Socket client) {
        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getRequestTimeoutMs() > 0 ? config.getRequestTimeoutMs() : DEFAULT_SO_TIMEOUT);
        } catch (SocketException e) {
            log.debug("Failed to configure client socket: {}", e.getMessage());
        }

        activeSockets.add(client);
        executor.submit(() -> {
            try {
                handleClient(client);
            } catch (RuntimeException e) {
                connectionErrors.increment();
                log.error("Unexpected error handling client {}: {}", client.getInetAddress(), e.getMessage(), e);
            } finally {
                activeSockets.remove(client);
                IoUtils.closeQuietly(client, "client socket");
            }
        });
    }

    /**
     * Waits for the server to finish binding to its port.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return the bound port, useful when configured with port 0.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    @Override
    public void stop() {
        log.info("Stopping HTTP front end on port {}...", getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Failed to close server socket: {}", e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("HTTP executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getConfig() {
        return config;
    }

    private void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());

            while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                // Keep-alive: next request on the same connection
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection from {} ended: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Reads and serves one request.
     *
     * @return true to keep the connection open for another request.
     */
    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String firstLine = IoUtils.readLine(in);
        if (firstLine == null || firstLine.isEmpty()) {
            return false;
        }

        RequestContext context;
        try {
            context = parseRequest(firstLine, in, remoteAddr);
        } catch (ProtocolException e) {
            log.warn("Malformed request from {}: {}", remoteAddr, e.getMessage());
            writeResponse(out, ProxyResponse.error(400, "Bad Request"), false, false, true);
            return false;
        }

        boolean http11 = !firstLine.endsWith("HTTP/1.0");
        String connection = context.getHeader(HeaderConstants.CONNECTION.getValue());
        boolean clientKeepAlive = http11
                ? !"close".equalsIgnoreCase(connection)
                : "keep-alive".equalsIgnoreCase(connection);
        boolean headRequest = "HEAD".equals(context.getMethod());
        try (ProxyResponse response = engine.handle(context)) {
            boolean keepAlive = writeResponse(out, response, clientKeepAlive, headRequest, http11);
            log.debug("{} {} from {} -> {}", context.getMethod(), context.getPath(), remoteAddr,
                    response.getStatus());
            return keepAlive;
        }
    }

    private RequestContext parseRequest(String firstLine, InputStream in, String remoteAddr) throws IOException {
        String[] parts = firstLine.split(" ");
        if (parts.length < 2) {
            throw new ProtocolException("Invalid request line: " + firstLine);
        }
        String method = parts[0];
        Map<String, String> headers = readHeaders(in);
        URI uri = parseUri(parts[1], headers);

        if ("chunked".equalsIgnoreCase(headers.get(HeaderConstants.TRANSFER_ENCODING.getValue()))) {
            throw new ProtocolException("Chunked request bodies are not supported");
        }
        byte[] body = new byte[0];
        String clStr = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (clStr != null) {
            long length;
            try {
                length = Long.parseLong(clStr.trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid Content-Length: " + clStr);
            }
            if (length < 0 || length > MAX_BODY_BYTES) {
                throw new ProtocolException("Unsupported Content-Length: " + length);
            }
            body = IoUtils.readFully(in, (int) length);
        }
        return new RequestContext(method, uri, headers, remoteAddr, body);
    }

    private Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx != -1) {
                headers.put(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
            }
        }
        return headers;
    }

    private static URI parseUri(String target, Map<String, String> headers) {
        try {
            URI uri = new URI(target);
            if (!uri.isAbsolute()) {
                String host = headers.get(HeaderConstants.HOST.getValue());
                uri = new URI("http://" + (host != null && !host.isEmpty() ? host : "localhost") + target);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ProtocolException("Invalid request target: " + target);
        }
    }

    /**
     * Writes the status line, headers and body.
     *
     * @return true if the connection may be reused.
     */
    private boolean writeResponse(OutputStream out, ProxyResponse response, boolean clientKeepAlive,
            boolean headRequest, boolean http11) throws IOException {
        int status = response.getStatus();
        String reasonPhrase = REASON_PHRASES.getOrDefault(status, "Unknown");
        StringBuilder head = new StringBuilder(256)
                .append("HTTP/1.1 ").append(status).append(' ').append(reasonPhrase).append("\r\n");

        boolean noBody = headRequest || status == 204 || status == 304 || (status >= 100 && status < 200);
        String declaredLength = response.getHeader(HeaderConstants.CONTENT_LENGTH.getValue());
        boolean lengthKnown = noBody || declaredLength != null || response.getContentLength() >= 0;
        boolean chunked = !lengthKnown && http11;
        boolean keepAlive = clientKeepAlive && (lengthKnown || chunked);

        for (Map.Entry<String, List<String>> header : response.getHeaders().entrySet()) {
            if (header.getKey().equalsIgnoreCase(HeaderConstants.CONNECTION.getValue())
                    || header.getKey().equalsIgnoreCase(HeaderConstants.TRANSFER_ENCODING.getValue())) {
                continue;
            }
            for (String value : header.getValue()) {
                head.append(header.getKey()).append(": ").append(value).append("\r\n");
            }
        }
        if (declaredLength == null && !noBody && response.getContentLength() >= 0) {
            head.append(HeaderConstants.CONTENT_LENGTH.getValue()).append(": ")
                    .append(response.getContentLength()).append("\r\n");
        }
        if (chunked) {
            head.append(HeaderConstants.TRANSFER_ENCODING.getValue()).append(": chunked\r\n");
        }
        if (!keepAlive) {
            head.append(HeaderConstants.CONNECTION.getValue()).append(": close\r\n");
        }
        head.append("\r\n");
        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));

        if (chunked) {
            IoUtils.transferChunked(response.getBody(), out);
        } else if (!noBody) {
            IoUtils.transfer(response.getBody(), out);
        }
        out.flush();
        return keepAlive;
    }
}
