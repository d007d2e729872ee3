package com.tollgate.proxy.core.traffic;

/**
 * Point-in-time counters of an {@link ABTest}. Rates are zero until the
 * variant has seen a request.
 */
public record ABTestStats(long requestsA, long requestsB, long successA, long successB, long errorsA,
        long errorsB) {

    public double successRateA() {
        return rate(successA, requestsA);
    }

    public double successRateB() {
        return rate(successB, requestsB);
    }

    public double errorRateA() {
        return rate(errorsA, requestsA);
    }

    public double errorRateB() {
        return rate(errorsB, requestsB);
    }

    private static double rate(long count, long requests) {
        return requests > 0 ? (double) count / requests : 0.0;
    }
}
