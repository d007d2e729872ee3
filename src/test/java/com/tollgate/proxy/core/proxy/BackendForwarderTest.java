package com.tollgate.proxy.core.proxy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.backend.Server;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

class BackendForwarderTest {

    private static WireMockServer backend;

    @BeforeAll
    static void startBackend() {
        backend = new WireMockServer(wireMockConfig().dynamicPort());
        backend.start();
    }

    @AfterAll
    static void stopBackend() {
        backend.stop();
    }

    @Test
    void forward_sendsMethodPathQueryAndBody() throws Exception {
        backend.stubFor(post(urlEqualTo("/orders?draft=true"))
                .willReturn(aResponse().withStatus(201).withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":7}")));
        Server server = new Pool("orders").addServer("http://localhost:" + backend.port() + "/", 1);
        RequestContext ctx = new RequestContext("POST", URI.create("http://shop.local/orders?draft=true"),
                Map.of("Content-Type", "application/json"), "10.1.1.1",
                "{\"item\":1}".getBytes(StandardCharsets.UTF_8));

        HttpResponse<InputStream> response = new BackendForwarder(Duration.ofSeconds(2), Duration.ofSeconds(5))
                .forward(ctx, server);

        assertThat(response.statusCode()).isEqualTo(201);
        try (InputStream body = response.body()) {
            assertThat(new String(body.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":7}");
        }
        backend.verify(postRequestedFor(urlEqualTo("/orders?draft=true"))
                .withRequestBody(equalTo("{\"item\":1}"))
                .withHeader("X-Forwarded-For", equalTo("10.1.1.1")));
    }

    @Test
    void forwardedHeaders_appendsClientToChain() {
        Map<String, String> headers = new HashMap<>();
        headers.put("X-Forwarded-For", "203.0.113.9");
        headers.put("X-Forwarded-Proto", "https");
        headers.put("Connection", "keep-alive");
        headers.put("Proxy-Authorization", "Basic abc");
        headers.put("Host", "shop.local");
        headers.put("Accept", "text/html");
        RequestContext ctx = new RequestContext("GET", URI.create("http://shop.local/"), headers, "10.1.1.1");

        Map<String, String> out = BackendForwarder.forwardedHeaders(ctx);

        assertThat(out).containsEntry("X-Forwarded-For", "203.0.113.9, 10.1.1.1")
                .containsEntry("X-Forwarded-Proto", "https")
                .containsEntry("X-Real-IP", "203.0.113.9")
                .containsEntry("Accept", "text/html")
                .doesNotContainKeys("Connection", "Proxy-Authorization", "Host");
    }

    @Test
    void forwardedHeaders_defaultsForDirectClient() {
        RequestContext ctx = new RequestContext("GET", URI.create("http://shop.local/"), Map.of(), "10.1.1.1");

        Map<String, String> out = BackendForwarder.forwardedHeaders(ctx);

        assertThat(out).containsEntry("X-Forwarded-For", "10.1.1.1")
                .containsEntry("X-Forwarded-Proto", "http")
                .containsEntry("X-Real-IP", "10.1.1.1");
    }

    @Test
    void responseHeaders_dropsHopByHopAndPseudoHeaders() {
        Map<String, List<String>> in = new HashMap<>();
        in.put("Content-Type", List.of("text/plain"));
        in.put("transfer-encoding", List.of("chunked"));
        in.put("Keep-Alive", List.of("timeout=5"));
        in.put(":status", List.of("200"));

        assertThat(BackendForwarder.responseHeaders(in)).containsOnlyKeys("Content-Type");
    }

    @Test
    void targetUri_joinsBaseAndRequestPath() {
        Server server = new Pool("p").addServer("http://backend.local:9000/", 1);
        RequestContext ctx = new RequestContext("GET", URI.create("http://shop.local/a/b?x=1&y=2"), Map.of(),
                "10.1.1.1");

        assertThat(BackendForwarder.targetUri(server, ctx))
                .isEqualTo(URI.create("http://backend.local:9000/a/b?x=1&y=2"));
    }
}
