package io.committer.spi;

/**
 * Observability hook for exporting committer counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of batches fully committed.
     */
    void incrementCommitSuccess();

    /**
     * Increments the count of commits that returned a partial {@code RetryBatch} outcome.
     */
    void incrementCommitPartialRetry();

    /**
     * Increments the count of commits that failed with a recoverable exception and will be retried.
     */
    void incrementCommitFailure();

    /**
     * Increments the count of units stopped by an unrecoverable failure or an exhausted strategy.
     */
    void incrementUnrecoverable();

    /**
     * Increments the count of heartbeats delivered to committers.
     */
    void incrementHeartbeat();

    /**
     * Increments the count of failed committer creations that will be retried.
     */
    void incrementCreateFailure();

    /**
     * Records the number of units currently bound to a committer.
     *
     * @param activeUnits number of active units
     */
    void recordActiveUnits(int activeUnits);

    /**
     * Records the time spent in a single commit call.
     *
     * @param durationMs commit duration in milliseconds (always non-negative)
     */
    default void recordCommitDurationMs(long durationMs) {
    }

    /**
     * Records the number of messages handed to a single commit call.
     *
     * @param size batch size (always positive)
     */
    default void recordBatchSize(int size) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCommitSuccess() {
        }

        @Override
        public void incrementCommitPartialRetry() {
        }

        @Override
        public void incrementCommitFailure() {
        }

        @Override
        public void incrementUnrecoverable() {
        }

        @Override
        public void incrementHeartbeat() {
        }

        @Override
        public void incrementCreateFailure() {
        }

        @Override
        public void recordActiveUnits(int activeUnits) {
        }
    }
}
