package io.committer.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry strategy picking a uniformly random delay in {@code [minDelay, maxDelay]} for every
 * attempt. Never exhausted.
 */
public final class RandomMinMaxRetryStrategy implements RetryStrategy {
    private final long minDelayMs;
    private final long maxDelayMs;

    /**
     * @param minDelay smallest delay (inclusive)
     * @param maxDelay largest delay (inclusive), not below {@code minDelay}
     */
    public RandomMinMaxRetryStrategy(Duration minDelay, Duration maxDelay) {
        this(Objects.requireNonNull(minDelay, "minDelay").toMillis(),
                Objects.requireNonNull(maxDelay, "maxDelay").toMillis());
    }

    /**
     * @param minDelayMs smallest delay in milliseconds (inclusive)
     * @param maxDelayMs largest delay in milliseconds (inclusive)
     */
    public RandomMinMaxRetryStrategy(long minDelayMs, long maxDelayMs) {
        if (minDelayMs < 0) {
            throw new IllegalArgumentException("minDelayMs must be >= 0, got: " + minDelayMs);
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= minDelayMs, got: "
                    + maxDelayMs + " < " + minDelayMs);
        }
        if (maxDelayMs == Long.MAX_VALUE) {
            throw new IllegalArgumentException("maxDelayMs must be < Long.MAX_VALUE");
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        if (minDelayMs == maxDelayMs) {
            return minDelayMs;
        }
        return ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1);
    }

    public long minDelayMs() {
        return minDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    @Override
    public String toString() {
        return "RandomMinMaxRetryStrategy{minDelayMs=" + minDelayMs + ", maxDelayMs=" + maxDelayMs + '}';
    }
}
