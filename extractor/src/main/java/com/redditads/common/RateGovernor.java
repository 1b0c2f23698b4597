package com.redditads.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum-interval request pacer. One instance is shared by every stream of a run so the Ads API
 * sees at most one request per interval, whichever stream is calling.
 */
public class RateGovernor {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos;

    /**
     * @param minInterval minimum spacing between two permits; {@link Duration#ZERO} disables pacing
     */
    public RateGovernor(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be zero or positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nextFreeAtNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * Governor that never waits. Used by tests and by callers that pace themselves.
     */
    public static RateGovernor unthrottled() {
        return new RateGovernor(Duration.ZERO);
    }

    /**
     * Blocks until the interval since the previous permit has elapsed, then returns.
     */
    public void acquire() {
        if (minIntervalNanos == 0) {
            return;
        }
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                try {
                    Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate governor interrupted", e);
                }
            }
        } while (true);
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
