package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;
import com.tollgate.proxy.core.routing.PoolSelector;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of A/B tests and sticky variant selection.
 */
public class ABTestManager {

    private final Map<String, ABTest> tests = new ConcurrentHashMap<>();

    public void addTest(ABTest test) {
        tests.put(test.getName(), test);
    }

    /**
     * Picks the variant for a request. A caller's bucket is fixed by its
     * identifier, so repeated calls land on the same variant.
     *
     * @param testName test name.
     * @param request  the request.
     * @return the variant pool, or null for an unknown test.
     */
    public Pool selectVariant(String testName, RequestContext request) {
        ABTest test = tests.get(testName);
        if (test == null) {
            return null;
        }
        if (RoutingKeys.bucket(request) < (long) test.getSplitPercent()) {
            test.requestsB.incrementAndGet();
            return test.getVariantB();
        }
        test.requestsA.incrementAndGet();
        return test.getVariantA();
    }

    /**
     * @param testName test name.
     * @return a selector bound to the test, for use on a route.
     */
    public PoolSelector selector(String testName) {
        return request -> selectVariant(testName, request);
    }

    public void recordSuccess(String testName, boolean variantB) {
        ABTest test = tests.get(testName);
        if (test == null) {
            return;
        }
        (variantB ? test.successB : test.successA).incrementAndGet();
    }

    public void recordError(String testName, boolean variantB) {
        ABTest test = tests.get(testName);
        if (test == null) {
            return;
        }
        (variantB ? test.errorsB : test.errorsA).incrementAndGet();
    }

    /**
     * @param testName test name.
     * @return a snapshot, or null for an unknown test.
     */
    public ABTestStats getStats(String testName) {
        ABTest test = tests.get(testName);
        if (test == null) {
            return null;
        }
        return new ABTestStats(test.requestsA.get(), test.requestsB.get(), test.successA.get(),
                test.successB.get(), test.errorsA.get(), test.errorsB.get());
    }

    public ABTest getTest(String testName) {
        return tests.get(testName);
    }
}
