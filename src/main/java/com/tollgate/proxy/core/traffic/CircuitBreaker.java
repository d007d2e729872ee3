package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.exceptions.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Circuit breaker guarding calls to a failing dependency.
 *
 * <p>
 * States:
 * </p>
 * <ul>
 * <li>CLOSED: calls pass through. Failures accumulate and never decay; reaching
 * the failure threshold opens the breaker.</li>
 * <li>OPEN: calls are rejected with {@link CircuitOpenException}. The first
 * attempt after the timeout moves the breaker to HALF_OPEN.</li>
 * <li>HALF_OPEN: one failure reopens it; the success threshold closes it and
 * resets the failure count.</li>
 * </ul>
 *
 * <p>
 * Transitions are serialized on the breaker's monitor. The wrapped action runs
 * outside it, so concurrent calls in HALF_OPEN are not limited to one probe.
 * </p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * A call guarded by the breaker.
     *
     * @param <T> result type.
     */
    @FunctionalInterface
    public interface Action<T> {
        T run() throws Exception;
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final long timeoutNanos;
    private final LongSupplier clock;

    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private volatile State state = State.CLOSED;
    private volatile long lastFailureNanos;

    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration timeout) {
        this(name, failureThreshold, successThreshold, timeout, System::nanoTime);
    }

    /**
     * Creates a breaker with an explicit clock.
     *
     * @param name             name used in logs.
     * @param failureThreshold failures that open the breaker.
     * @param successThreshold HALF_OPEN successes that close it.
     * @param timeout          time OPEN before a trial call is let through.
     * @param clock            nanosecond time source.
     */
    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration timeout,
            LongSupplier clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.timeoutNanos = timeout.toNanos();
        this.clock = clock;
    }

    /**
     * Runs the action if the breaker admits it and records the outcome.
     *
     * @param action the guarded call.
     * @param <T>    result type.
     * @return the action's result.
     * @throws CircuitOpenException if the breaker is open.
     * @throws Exception            whatever the action throws.
     */
    public <T> T call(Action<T> action) throws Exception {
        acquire();
        T result;
        try {
            result = action.run();
        } catch (Exception e) {
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * Admission check. Moves OPEN to HALF_OPEN once the timeout has elapsed.
     *
     * @throws CircuitOpenException if the call must be rejected.
     */
    public synchronized void acquire() {
        if (state != State.OPEN) {
            return;
        }
        if (clock.getAsLong() - lastFailureNanos > timeoutNanos) {
            state = State.HALF_OPEN;
            successCount.set(0);
            log.info("Circuit breaker {} half-open", name);
            return;
        }
        throw new CircuitOpenException("Circuit breaker " + name + " is open");
    }

    /**
     * Records a failed call.
     */
    public synchronized void recordFailure() {
        int failures = failureCount.incrementAndGet();
        lastFailureNanos = clock.getAsLong();
        if (state == State.HALF_OPEN) {
            state = State.OPEN;
            log.warn("Circuit breaker {} reopened after a failed trial call", name);
        } else if (state == State.CLOSED && failures >= failureThreshold) {
            state = State.OPEN;
            log.warn("Circuit breaker {} opened after {} failures", name, failures);
        }
    }

    /**
     * Records a successful call.
     */
    public synchronized void recordSuccess() {
        int successes = successCount.incrementAndGet();
        if (state == State.HALF_OPEN && successes >= successThreshold) {
            state = State.CLOSED;
            failureCount.set(0);
            log.info("Circuit breaker {} closed", name);
        }
    }

    public State getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public String getName() {
        return name;
    }
}
