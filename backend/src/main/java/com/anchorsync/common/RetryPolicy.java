package com.anchorsync.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter and a delay ceiling.
 * Shared by JSON-RPC calls and the job queue's requeue delay.
 */
public final class RetryPolicy {

    private static final long DEFAULT_MAX_DELAY_MS = 300_000L;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, DEFAULT_MAX_DELAY_MS, jitterFactor, maxAttempts);
    }

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = Math.max(0, jitterFactor);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt:
     * min(base * 2^attempt, max), then jittered.
     */
    public long delayMs(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), 20);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public boolean canRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 1s base, 20% jitter, 5 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }
}
