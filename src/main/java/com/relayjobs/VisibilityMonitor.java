package com.relayjobs;

import java.util.concurrent.TimeUnit;

public class VisibilityMonitor {
    private final long startupNanos;
    private final long heartbeatNanos;
    private final long spawnedAt;
    private long lastSignal;
    private boolean started;
    private boolean lateStart;

    public VisibilityMonitor(int startupHeartbeatSec, int heartbeatEverySec, long spawnedAtNanos) {
        this.startupNanos = TimeUnit.SECONDS.toNanos(startupHeartbeatSec);
        this.heartbeatNanos = TimeUnit.SECONDS.toNanos(heartbeatEverySec);
        this.spawnedAt = spawnedAtNanos;
    }

    /** A first signal past the startup window keeps the job degraded until the next one. */
    public synchronized void signal(long nowNanos) {
        lateStart = !started && startupNanos > 0 && nowNanos - spawnedAt > startupNanos;
        started = true;
        lastSignal = nowNanos;
    }

    public synchronized boolean hasStarted() {
        return started;
    }

    public synchronized String evaluate(long nowNanos) {
        if (!started) {
            if (startupNanos > 0 && nowNanos - spawnedAt > startupNanos) return Models.VISIBILITY_DEGRADED;
            return Models.VISIBILITY_OK;
        }
        if (lateStart) return Models.VISIBILITY_DEGRADED;
        if (heartbeatNanos > 0 && nowNanos - lastSignal > heartbeatNanos) return Models.VISIBILITY_DEGRADED;
        return Models.VISIBILITY_OK;
    }

    public synchronized long silentSeconds(long nowNanos) {
        return TimeUnit.NANOSECONDS.toSeconds(nowNanos - (started ? lastSignal : spawnedAt));
    }
}
