package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;
import com.tollgate.proxy.core.routing.PoolSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ABTestManagerTest {

    private ABTestManager manager;
    private Pool control;
    private Pool experiment;

    @BeforeEach
    void setUp() {
        manager = new ABTestManager();
        control = new Pool("control");
        experiment = new Pool("experiment");
    }

    private static RequestContext user(String id) {
        return new RequestContext("GET", URI.create("http://example.com/"), Map.of("X-User-ID", id), "10.0.0.1");
    }

    @Test
    void selectVariant_isStickyPerUser() {
        manager.addTest(new ABTest("checkout", control, experiment, 50));

        Pool first = manager.selectVariant("checkout", user("alice"));
        for (int i = 0; i < 20; i++) {
            assertThat(manager.selectVariant("checkout", user("alice"))).isSameAs(first);
        }
    }

    @Test
    void selectVariant_convergesToSplit() {
        manager.addTest(new ABTest("checkout", control, experiment, 30));
        Random random = new Random(42);
        int total = 10_000;
        int variantB = 0;

        for (int i = 0; i < total; i++) {
            String id = new UUID(random.nextLong(), random.nextLong()).toString();
            if (manager.selectVariant("checkout", user(id)) == experiment) {
                variantB++;
            }
        }

        assertThat(variantB / (double) total).isCloseTo(0.30, within(0.05));
        ABTestStats stats = manager.getStats("checkout");
        assertThat(stats.requestsA() + stats.requestsB()).isEqualTo(total);
        assertThat(stats.requestsB()).isEqualTo(variantB);
    }

    @Test
    void selectVariant_extremeSplitsSendEveryoneOneWay() {
        manager.addTest(new ABTest("none", control, experiment, 0));
        manager.addTest(new ABTest("all", control, experiment, 100));

        for (int i = 0; i < 50; i++) {
            assertThat(manager.selectVariant("none", user("u" + i))).isSameAs(control);
            assertThat(manager.selectVariant("all", user("u" + i))).isSameAs(experiment);
        }
    }

    @Test
    void unknownTest_yieldsNull() {
        assertThat(manager.selectVariant("missing", user("alice"))).isNull();
        assertThat(manager.getStats("missing")).isNull();
        manager.recordSuccess("missing", true);
        manager.recordError("missing", false);
    }

    @Test
    void recordOutcomes_feedStats() {
        manager.addTest(new ABTest("checkout", control, experiment, 50));

        manager.recordSuccess("checkout", false);
        manager.recordSuccess("checkout", false);
        manager.recordError("checkout", false);
        manager.recordSuccess("checkout", true);

        ABTestStats stats = manager.getStats("checkout");
        assertThat(stats.successA()).isEqualTo(2);
        assertThat(stats.errorsA()).isEqualTo(1);
        assertThat(stats.successB()).isEqualTo(1);
        assertThat(stats.errorsB()).isZero();
        assertThat(stats.successRateA()).isZero();
    }

    @Test
    void stats_ratesUseRequestCounts() {
        ABTestStats stats = new ABTestStats(4, 2, 3, 1, 1, 1);

        assertThat(stats.successRateA()).isEqualTo(0.75);
        assertThat(stats.errorRateA()).isEqualTo(0.25);
        assertThat(stats.successRateB()).isEqualTo(0.5);
        assertThat(stats.errorRateB()).isEqualTo(0.5);
    }

    @Test
    void selector_delegatesToNamedTest() {
        manager.addTest(new ABTest("all", control, experiment, 100));
        PoolSelector selector = manager.selector("all");

        assertThat(selector.select(user("alice"))).isSameAs(experiment);
    }

    @Test
    void abTest_rejectsSplitOutsideRange() {
        assertThatThrownBy(() -> new ABTest("bad", control, experiment, 101))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ABTest("bad", control, experiment, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
