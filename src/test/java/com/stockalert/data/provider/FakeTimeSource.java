package com.stockalert.data.provider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual clock: sleeping advances time instantly and is recorded.
 */
public final class FakeTimeSource implements TimeSource {
    public final List<Duration> sleeps = new ArrayList<>();
    private long now;

    public void advance(Duration duration) {
        now += duration.toNanos();
    }

    @Override
    public long nanoTime() {
        return now;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        now += duration.toNanos();
    }
}
