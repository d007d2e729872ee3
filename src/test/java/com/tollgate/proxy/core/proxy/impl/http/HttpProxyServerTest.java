package com.tollgate.proxy.core.proxy.impl.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.tollgate.proxy.config.ServerConfig;
import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.ProxyEngine;
import com.tollgate.proxy.core.routing.Route;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

class HttpProxyServerTest {

    private WireMockServer backend;
    private ProxyEngine engine;
    private HttpProxyServer server;
    private SimpleMeterRegistry registry;
    private int port;

    @BeforeEach
    void setUp() {
        backend = new WireMockServer(wireMockConfig().dynamicPort());
        backend.start();
        backend.stubFor(get(urlEqualTo("/hello")).willReturn(aResponse().withStatus(200).withBody("hello world")));
        backend.stubFor(post(urlEqualTo("/echo")).willReturn(aResponse().withStatus(201).withBody("stored")));
        backend.stubFor(get(urlEqualTo("/stream")).willReturn(aResponse().withStatus(200)
                .withBody("streamed body").withChunkedDribbleDelay(3, 30)));

        registry = new SimpleMeterRegistry();
        engine = new ProxyEngine(registry);
        Pool pool = new Pool("backend");
        pool.addServer("http://localhost:" + backend.port(), 1);
        engine.addRoute(new Route("all", pool));

        ServerConfig config = new ServerConfig();
        config.setHost("127.0.0.1");
        config.setPort(0);
        config.setRequestTimeoutMs(5000);
        server = new HttpProxyServer(config, engine, registry);
        Thread acceptThread = new Thread(server::start, "http-accept-test");
        acceptThread.setDaemon(true);
        acceptThread.start();
        assertThat(server.awaitBind(5, TimeUnit.SECONDS)).isTrue();
        port = server.getLocalPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.shutdown();
        backend.stop();
    }

    private static String exchange(int port, String rawRequest) throws Exception {
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(rawRequest.getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            InputStream in = socket.getInputStream();
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.ISO_8859_1);
        }
    }

    private static String dechunk(String framed) {
        StringBuilder body = new StringBuilder();
        int pos = 0;
        while (true) {
            int lineEnd = framed.indexOf("\r\n", pos);
            int size = Integer.parseInt(framed.substring(pos, lineEnd), 16);
            if (size == 0) {
                return body.toString();
            }
            body.append(framed, lineEnd + 2, lineEnd + 2 + size);
            pos = lineEnd + 2 + size + 2;
        }
    }

    @Test
    void proxiesGetThroughHttpClient() throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/hello"))
                .GET()
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("hello world");
    }

    @Test
    void keepsConnectionAliveBetweenRequests() throws Exception {
        HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/hello"))
                .GET()
                .build();

        for (int i = 0; i < 3; i++) {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            assertThat(response.body()).isEqualTo("hello world");
        }
        assertThat(registry.get("proxy.connections.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void rechunksResponseOfUnknownLengthForHttp11Clients() throws Exception {
        String response = exchange(port, "GET /stream HTTP/1.1\r\nHost: shop.local\r\nConnection: close\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 200 OK\r\n");
        assertThat(response).contains("Transfer-Encoding: chunked\r\n").doesNotContain("Content-Length");
        assertThat(response).endsWith("\r\n0\r\n\r\n");
        assertThat(dechunk(response.substring(response.indexOf("\r\n\r\n") + 4))).isEqualTo("streamed body");
    }

    @Test
    void keepsConnectionAliveForChunkedResponses() throws Exception {
        HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/stream"))
                .GET()
                .build();

        for (int i = 0; i < 3; i++) {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            assertThat(response.body()).isEqualTo("streamed body");
        }
        assertThat(registry.get("proxy.connections.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void closesConnectionForHttp10ResponseOfUnknownLength() throws Exception {
        String response = exchange(port, "GET /stream HTTP/1.0\r\nHost: shop.local\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 200 OK\r\n");
        assertThat(response).contains("Connection: close\r\n").doesNotContain("Transfer-Encoding");
        assertThat(response).endsWith("\r\n\r\nstreamed body");
    }

    @Test
    void forwardsRequestBody() throws Exception {
        String response = exchange(port, "POST /echo HTTP/1.1\r\n"
                + "Host: shop.local\r\n"
                + "Content-Length: 7\r\n"
                + "Connection: close\r\n"
                + "\r\n"
                + "payload");

        assertThat(response).startsWith("HTTP/1.1 201 Created\r\n");
        assertThat(response).contains("Connection: close").endsWith("stored");
        backend.verify(postRequestedFor(urlEqualTo("/echo")).withRequestBody(equalTo("payload")));
    }

    @Test
    void answersUnknownRouteWith404() throws Exception {
        engine.getRouter().removeRoute("all");

        String response = exchange(port, "GET /nowhere HTTP/1.1\r\nHost: shop.local\r\nConnection: close\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 404 Not Found\r\n");
        assertThat(response).contains("Content-Length: 10").endsWith("Not Found\n");
    }

    @Test
    void rejectsMalformedRequestLine() throws Exception {
        String response = exchange(port, "GARBAGE\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 400 Bad Request\r\n");
    }

    @Test
    void rejectsChunkedRequestBody() throws Exception {
        String response = exchange(port, "POST /echo HTTP/1.1\r\n"
                + "Host: shop.local\r\n"
                + "Transfer-Encoding: chunked\r\n"
                + "\r\n"
                + "7\r\npayload\r\n0\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 400 Bad Request\r\n");
    }

    @Test
    void omitsBodyForHead() throws Exception {
        backend.stubFor(head(urlEqualTo("/hello"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Length", "11")));

        String response = exchange(port, "HEAD /hello HTTP/1.1\r\nHost: shop.local\r\nConnection: close\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 200 OK\r\n").endsWith("\r\n\r\n");
    }
}
