package com.tollgate.proxy.core.traffic;

import com.tollgate.proxy.core.backend.Pool;
import com.tollgate.proxy.core.proxy.RequestContext;
import com.tollgate.proxy.core.routing.PoolSelector;
import com.tollgate.proxy.core.utils.DaemonThreadFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Blue-green deployment switch with a timed, gradual traffic shift.
 *
 * <p>
 * While a shift runs, callers whose sticky bucket falls under the current
 * shift percentage go to the shift target and everyone else stays on the
 * active version. A shift raises that percentage from 0 to 100 over its
 * duration on a 100 ms tick, then makes the target the active version, which
 * from then on serves all traffic.
 * </p>
 */
public class BlueGreenManager implements PoolSelector {

    private static final Logger log = LoggerFactory.getLogger(BlueGreenManager.class);

    public static final String BLUE = "blue";
    public static final String GREEN = "green";

    static final long TICK_MILLIS = 100;

    private final Pool blue;
    private final Pool green;
    private final ScheduledExecutorService scheduler;

    private volatile String activeVersion = BLUE;
    private volatile double trafficShift;
    private volatile String shiftTarget;
    private volatile long startNanos = System.nanoTime();
    private volatile Duration shiftDuration = Duration.ZERO;
    private ShiftTask shiftTask;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public BlueGreenManager(Pool blue, Pool green) {
        this.blue = blue;
        this.green = green;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("blue-green"));
    }

    @Override
    public Pool select(RequestContext request) {
        return selectBackend(request);
    }

    /**
     * @param request the request.
     * @return the pool of the version serving this caller right now.
     */
    public Pool selectBackend(RequestContext request) {
        String target = shiftTarget;
        if (target != null && RoutingKeys.bucket(request) < (long) trafficShift) {
            return pool(target);
        }
        return pool(activeVersion);
    }

    private Pool pool(String version) {
        return BLUE.equals(version) ? blue : green;
    }

    /**
     * Starts shifting traffic towards {@code targetVersion}. A shift already in
     * progress is cancelled.
     *
     * @param targetVersion {@code "blue"} or {@code "green"}.
     * @param duration      time until the target takes all traffic.
     */
    public synchronized void startGradualShift(String targetVersion, Duration duration) {
        if (!BLUE.equals(targetVersion) && !GREEN.equals(targetVersion)) {
            throw new IllegalArgumentException("Unknown version: " + targetVersion);
        }
        if (shiftTask != null) {
            shiftTask.cancel();
        }
        startNanos = System.nanoTime();
        shiftDuration = duration;
        trafficShift = 0;
        shiftTarget = targetVersion;
        log.info("Shifting traffic to {} over {} ms", targetVersion, duration.toMillis());
        shiftTask = new ShiftTask(targetVersion, startNanos, duration.toNanos());
        shiftTask.schedule();
    }

    /**
     * @return active version, shift percentage, shift duration and elapsed time.
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("active_version", activeVersion);
        status.put("traffic_shift", trafficShift);
        status.put("shift_duration", shiftDuration.toString());
        status.put("elapsed", Duration.ofNanos(System.nanoTime() - startNanos).toString());
        return status;
    }

    public String getActiveVersion() {
        return activeVersion;
    }

    public double getTrafficShift() {
        return trafficShift;
    }

    /**
     * @return the version a running shift moves traffic to, or null when no shift is running.
     */
    public String getShiftTarget() {
        return shiftTarget;
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    /** One gradual shift; reschedules itself every tick until done or cancelled. */
    private final class ShiftTask implements Runnable {
        private final String targetVersion;
        private final long start;
        private final long durationNanos;
        private volatile boolean cancelled;

        ShiftTask(String targetVersion, long start, long durationNanos) {
            this.targetVersion = targetVersion;
            this.start = start;
            this.durationNanos = durationNanos;
        }

        void schedule() {
            if (cancelled) {
                return;
            }
            try {
                scheduler.schedule(this, TICK_MILLIS, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Traffic shift to {} stopped: scheduler shut down", targetVersion);
            }
        }

        void cancel() {
            cancelled = true;
        }

        @Override
        public void run() {
            if (cancelled) {
                return;
            }
            long elapsed = System.nanoTime() - start;
            if (elapsed >= durationNanos) {
                activeVersion = targetVersion;
                trafficShift = 100;
                shiftTarget = null;
                log.info("Traffic shift complete, {} is active", targetVersion);
                return;
            }
            trafficShift = elapsed / (double) durationNanos * 100;
            schedule();
        }
    }
}
