package com.tollgate.proxy.core.cache;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.backend.Server;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponseCacheTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private Clock clock;
    private ResponseCache cache;
    private Server server;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        cache = new ResponseCache(clock);
        server = new Pool("api").addServer("http://backend.local:9000", 1);
    }

    @Test
    void key_combinesMethodPathAndServer() {
        assertThat(ResponseCache.key("GET", "/users", server)).isEqualTo("GET:/users:http://backend.local:9000");
    }

    @Test
    void get_returnsFreshEntry() {
        String key = ResponseCache.key("GET", "/users", server);
        cache.put(key, 200, Map.of("Content-Type", List.of("application/json")),
                "[]".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(60));

        when(clock.instant()).thenReturn(T0.plusSeconds(59));
        CacheEntry entry = cache.get(key);

        assertThat(entry).isNotNull();
        assertThat(entry.getStatus()).isEqualTo(200);
        assertThat(entry.getHeaders()).containsEntry("Content-Type", List.of("application/json"));
        assertThat(new String(entry.getBody(), StandardCharsets.UTF_8)).isEqualTo("[]");
    }

    @Test
    void get_treatsEntryAsExpiredAtExpiryInstant() {
        String key = ResponseCache.key("GET", "/users", server);
        cache.put(key, 200, Map.of(), new byte[0], Duration.ofSeconds(60));

        when(clock.instant()).thenReturn(T0.plusSeconds(60));

        assertThat(cache.get(key)).isNull();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void put_replacesPreviousEntry() {
        String key = ResponseCache.key("GET", "/users", server);
        cache.put(key, 200, Map.of(), "old".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(60));
        cache.put(key, 200, Map.of(), "new".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(60));

        assertThat(new String(cache.get(key).getBody(), StandardCharsets.UTF_8)).isEqualTo("new");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void clear_removesEverything() {
        cache.put("a", 200, Map.of(), new byte[0], Duration.ofSeconds(60));
        cache.put("b", 200, Map.of(), new byte[0], Duration.ofSeconds(60));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get("a")).isNull();
    }
}
