package com.questrail.meshinfo.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Production {@link Sleeper} backed by {@link Thread#sleep(long, int)}.
 */
public enum ThreadSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        long nanos = duration.toNanos();
        Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
    }
}
