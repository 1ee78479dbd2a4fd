package io.committer.retry;

/**
 * Strategy for computing the delay before the next attempt after a failure, or deciding
 * that no further attempt should be made.
 *
 * <p>Implementations must be stateless: the only input is the attempt count supplied by the
 * caller. One instance is shared by every unit of a factory and called from many threads.
 * Per-unit progress lives in a {@link RetryTracker}.
 *
 * @see RandomMinMaxRetryStrategy
 * @see TruncatedBinaryExponentialBackoffStrategy
 * @see RetryTracker
 */
public interface RetryStrategy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative); {@code 0} when {@code attempts <= 0}
     */
    long computeDelayMs(int attempts);

    /**
     * Returns whether the attempt budget is used up after {@code attempts} failures.
     *
     * <p>Defaults to {@code false}: retry indefinitely.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return {@code true} if no further attempt should be made
     */
    default boolean isExhausted(int attempts) {
        return false;
    }
}
