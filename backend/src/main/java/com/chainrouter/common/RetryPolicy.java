package com.chainrouter.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for RPC retries: {@code baseDelay * 2^retryCount}, optionally with ±jitter.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds before the retry numbered {@code retryCount} (1 for the first retry).
     * Formula: baseDelay * 2^retryCount, then ±jitter.
     */
    public long delayMs(int retryCount) {
        if (retryCount <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(retryCount, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /**
     * Retries allowed after the first attempt; applied to every request the router builds.
     */
    public int getMaxRetries() {
        return maxRetries;
    }
}
