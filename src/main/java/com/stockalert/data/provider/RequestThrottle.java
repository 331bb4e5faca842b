package com.stockalert.data.provider;

import java.time.Duration;

/**
 * Enforces a minimum spacing between any two outbound requests, whatever the symbol or
 * provider. Not thread-safe: the fetch path runs on a single thread.
 */
public final class RequestThrottle {
    private final boolean enabled;
    private final Duration minInterval;
    private final TimeSource time;
    private boolean called;
    private long lastCallNanos;

    public RequestThrottle(boolean enabled, Duration minInterval, TimeSource time) {
        this.enabled = enabled;
        this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.time = time;
    }

    public static RequestThrottle disabled(TimeSource time) {
        return new RequestThrottle(false, Duration.ZERO, time);
    }

    /**
     * Blocks until the minimum interval since the previous call has elapsed, then records
     * this call.
     */
    public void acquire() throws InterruptedException {
        if (!enabled) {
            return;
        }
        if (called) {
            long elapsed = time.nanoTime() - lastCallNanos;
            long remaining = minInterval.toNanos() - elapsed;
            if (remaining > 0) {
                time.sleep(Duration.ofNanos(remaining));
            }
        }
        lastCallNanos = time.nanoTime();
        called = true;
    }

    public boolean enabled() {
        return enabled;
    }

    public Duration minInterval() {
        return minInterval;
    }
}
