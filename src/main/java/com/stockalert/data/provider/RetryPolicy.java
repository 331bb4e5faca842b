package com.stockalert.data.provider;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(maxDelay, baseDelay * 2^attempt + jitter)}, floored at the
 * throttle interval when rate limiting is on.
 */
public final class RetryPolicy {
    public static final double MAX_JITTER_SECONDS = 0.5;

    private final int maxAttempts;
    private final double baseDelaySeconds;
    private final double maxDelaySeconds;

    public RetryPolicy(int maxAttempts, double baseDelaySeconds, double maxDelaySeconds) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelaySeconds = Math.max(0.0, baseDelaySeconds);
        this.maxDelaySeconds = Math.max(0.0, maxDelaySeconds);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempt zero-based attempt that just failed
     * @param jitterSeconds uniform draw in [0, 0.5)
     */
    public Duration backoffDelay(int attempt, double jitterSeconds, RequestThrottle throttle) {
        double delay = Math.min(maxDelaySeconds, baseDelaySeconds * Math.pow(2.0, attempt) + jitterSeconds);
        if (throttle != null && throttle.enabled()) {
            delay = Math.max(delay, throttle.minInterval().toNanos() / 1_000_000_000.0);
        }
        return Duration.ofNanos(Math.round(delay * 1_000_000_000.0));
    }
}
