package com.redditads.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff (factor 2) with optional jitter, bounded by a total attempt count.
 * Attempts include the first call: {@code maxAttempts = 5} means one call plus four retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Backoff before the next call, given how many calls were made so far (one-based):
     * {@code base * 2^(attemptsMade - 1)}, spread by up to {@code ±jitterFactor}.
     */
    public long delayAfterMs(int attemptsMade) {
        int doublings = Math.min(Math.max(attemptsMade - 1, 0), 20);
        long delay = baseDelayMs << doublings;
        if (jitterFactor <= 0 || delay == 0) {
            return delay;
        }
        double spread = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Math.max(0L, Math.round(delay * (1.0 + spread)));
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} calls.
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 2s base, ±20% jitter, 5 attempts (2s, 4s, 8s, 16s between them).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.2, 5);
    }
}
