package io.committer.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry strategy doubling the delay on every failure, truncated at a maximum.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}. The
 * delay is deterministic, so it never decreases as {@code attempts} grows.
 *
 * <p>With a bounded {@code maxRetries}, the strategy is exhausted once more than
 * {@code maxRetries} attempts have failed.
 */
public final class TruncatedBinaryExponentialBackoffStrategy implements RetryStrategy {

    /** Value of {@code maxRetries} meaning "retry forever". */
    public static final int UNBOUNDED = -1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxRetries;

    /**
     * Creates an unbounded strategy.
     *
     * @param baseDelay delay after the first failure
     * @param maxDelay  delay cap
     */
    public TruncatedBinaryExponentialBackoffStrategy(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, UNBOUNDED);
    }

    /**
     * @param baseDelay  delay after the first failure
     * @param maxDelay   delay cap
     * @param maxRetries number of retries allowed, or {@link #UNBOUNDED}
     */
    public TruncatedBinaryExponentialBackoffStrategy(Duration baseDelay, Duration maxDelay, int maxRetries) {
        this(Objects.requireNonNull(baseDelay, "baseDelay").toMillis(),
                Objects.requireNonNull(maxDelay, "maxDelay").toMillis(), maxRetries);
    }

    /**
     * @param baseDelayMs delay after the first failure (milliseconds)
     * @param maxDelayMs  delay cap (milliseconds)
     * @param maxRetries  number of retries allowed, or {@link #UNBOUNDED}
     */
    public TruncatedBinaryExponentialBackoffStrategy(long baseDelayMs, long maxDelayMs, int maxRetries) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: "
                    + maxDelayMs + " < " + baseDelayMs);
        }
        if (maxRetries < 0 && maxRetries != UNBOUNDED) {
            throw new IllegalArgumentException("maxRetries must be >= 0 or UNBOUNDED, got: " + maxRetries);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxRetries = maxRetries;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        if (attempts >= 63) {
            return maxDelayMs;
        }
        long multiplier = 1L << (attempts - 1);
        // Overflow guard: once the product would pass the cap, the cap wins
        if (multiplier > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * multiplier);
    }

    @Override
    public boolean isExhausted(int attempts) {
        return maxRetries != UNBOUNDED && attempts > maxRetries;
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "TruncatedBinaryExponentialBackoffStrategy{baseDelayMs=" + baseDelayMs
                + ", maxDelayMs=" + maxDelayMs
                + ", maxRetries=" + (maxRetries == UNBOUNDED ? "unbounded" : maxRetries) + '}';
    }
}
