package com.stockalert.data.provider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Monotonic time and blocking sleep, replaceable in tests.
 */
public interface TimeSource {
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (duration.isNegative() || duration.isZero()) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;
}
