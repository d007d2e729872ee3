package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class BlueGreenManagerTest {

    private Pool blue;
    private Pool green;
    private BlueGreenManager manager;

    @BeforeEach
    void setUp() {
        blue = new Pool("blue");
        green = new Pool("green");
        manager = new BlueGreenManager(blue, green);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static RequestContext user(String id) {
        return new RequestContext("GET", URI.create("http://example.com/"), Map.of("X-User-ID", id), "10.0.0.1");
    }

    @Test
    void blueServesEverythingInitially() {
        assertThat(manager.getActiveVersion()).isEqualTo(BlueGreenManager.BLUE);
        for (int i = 0; i < 50; i++) {
            assertThat(manager.selectBackend(user("user-" + i))).isSameAs(blue);
        }
    }

    @Test
    void gradualShift_endsWithTargetActive() {
        manager.startGradualShift(BlueGreenManager.GREEN, Duration.ofMillis(300));

        await().atMost(Duration.ofSeconds(5))
                .until(() -> BlueGreenManager.GREEN.equals(manager.getActiveVersion()));

        assertThat(manager.getTrafficShift()).isEqualTo(100.0);
        assertThat(manager.getShiftTarget()).isNull();
        for (int i = 0; i < 50; i++) {
            assertThat(manager.select(user("user-" + i))).isSameAs(green);
        }
    }

    @Test
    void gradualShift_backToBlueServesEverythingFromBlue() {
        manager.startGradualShift(BlueGreenManager.GREEN, Duration.ofMillis(200));
        await().atMost(Duration.ofSeconds(5))
                .until(() -> BlueGreenManager.GREEN.equals(manager.getActiveVersion()));

        manager.startGradualShift(BlueGreenManager.BLUE, Duration.ofMillis(200));
        await().atMost(Duration.ofSeconds(5))
                .until(() -> BlueGreenManager.BLUE.equals(manager.getActiveVersion()));

        for (int i = 0; i < 50; i++) {
            assertThat(manager.selectBackend(user("user-" + i))).isSameAs(blue);
        }
    }

    @Test
    void gradualShift_raisesShiftWhileRunning() {
        manager.startGradualShift(BlueGreenManager.GREEN, Duration.ofSeconds(10));

        await().atMost(Duration.ofSeconds(5)).until(() -> manager.getTrafficShift() > 0);

        assertThat(manager.getTrafficShift()).isLessThan(100.0);
        assertThat(manager.getActiveVersion()).isEqualTo(BlueGreenManager.BLUE);
        assertThat(manager.getShiftTarget()).isEqualTo(BlueGreenManager.GREEN);
    }

    @Test
    void newShiftCancelsPreviousOne() {
        manager.startGradualShift(BlueGreenManager.GREEN, Duration.ofSeconds(30));
        manager.startGradualShift(BlueGreenManager.BLUE, Duration.ofMillis(200));

        await().atMost(Duration.ofSeconds(5)).until(() -> manager.getShiftTarget() == null);

        assertThat(manager.getActiveVersion()).isEqualTo(BlueGreenManager.BLUE);
    }

    @Test
    void startGradualShift_rejectsUnknownVersion() {
        assertThatThrownBy(() -> manager.startGradualShift("red", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getStatus_reportsShiftState() {
        Map<String, Object> status = manager.getStatus();

        assertThat(status).containsKeys("active_version", "traffic_shift", "shift_duration", "elapsed");
        assertThat(status.get("active_version")).isEqualTo("blue");
        assertThat(status.get("traffic_shift")).isEqualTo(0.0);
    }
}
