package io.committer;

import io.committer.retry.RandomMinMaxRetryStrategy;
import io.committer.retry.RetryStrategy;
import io.committer.retry.TruncatedBinaryExponentialBackoffStrategy;

import java.time.Duration;

/**
 * Produces a {@link Committer} for each (topic, partition, id) unit and supplies the retry
 * policy the host applies to them.
 *
 * <p>There is a single factory instance per process. Implementations <b>must</b> declare a
 * public constructor taking a single {@code Map<String, String>} argument; the host creates the
 * factory reflectively through it. Other constructors are allowed.
 *
 * <h2>Synchronous vs Asynchronous Creation</h2>
 * <p>A factory that only implements {@link #create} gets an asynchronous path from the host:
 * each call runs on a worker thread, and all calls are serialized through one lock owned by
 * the host, so {@code create} never needs its own locking. A factory that needs real
 * concurrency implements {@link AsyncCommitterFactory} instead, in which case {@code create}
 * is never called and thread safety is its own concern.
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions from {@code create} are retried with
 * {@link #createCommitterExceptionRetryStrategy()}, except
 * {@link UnrecoverableCommitterFactoryException} (or any other {@link UnrecoverableException}),
 * which gives up on that unit permanently.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public final class AuditCommitterFactory implements CommitterFactory {
 *     private final String bucket;
 *
 *     public AuditCommitterFactory(Map<String, String> config) {
 *         this.bucket = config.getOrDefault("bucket", "audit");
 *     }
 *
 *     @Override
 *     public Committer create(String topic, int partition, int id) {
 *         return new AuditCommitter(bucket, topic, partition);
 *     }
 *
 *     @Override
 *     public TopicFilter createTopicFilter() {
 *         return TopicFilter.matching(Pattern.compile("audit\\..*"));
 *     }
 * }
 * }</pre>
 *
 * @see AsyncCommitterFactory
 * @see Committer
 */
public interface CommitterFactory extends AutoCloseable {

    /** Default pacing of polls when the log has no data: random 5 to 10 seconds, forever. */
    RetryStrategy DEFAULT_NO_DATA_BACKOFF_STRATEGY =
            new RandomMinMaxRetryStrategy(Duration.ofSeconds(5), Duration.ofSeconds(10));

    /** Default pacing of commit retries: random 1 to 16 seconds, forever. */
    RetryStrategy DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY =
            new RandomMinMaxRetryStrategy(Duration.ofSeconds(1), Duration.ofSeconds(16));

    /**
     * Create retries doubling from 1 second up to 1 minute, forever. Not used by default; return
     * it from {@link #createCommitterExceptionRetryStrategy()} to opt in.
     */
    RetryStrategy EXPONENTIAL_CREATE_COMMITTER_EXCEPTION_RETRY_STRATEGY =
            new TruncatedBinaryExponentialBackoffStrategy(Duration.ofSeconds(1), Duration.ofMinutes(1));

    /**
     * Creates the committer for a unit.
     *
     * @param topic     the topic the committer is bound to
     * @param partition the partition the committer is bound to
     * @param id        the committer id within the partition; with a parallelism factor of
     *                  {@code n} the host asks for ids {@code 0..n-1} of every partition
     * @return a committer, never {@code null}
     * @throws Exception if creation failed; retried unless it is an {@link UnrecoverableException}
     */
    Committer create(String topic, int partition, int id) throws Exception;

    /**
     * Strategy pacing polls while the log has no data.
     *
     * @return the no-data backoff strategy
     */
    default RetryStrategy noDataBackoffStrategy() {
        return DEFAULT_NO_DATA_BACKOFF_STRATEGY;
    }

    /**
     * Strategy pacing retries of commits that failed with a recoverable exception.
     *
     * @return the commit retry strategy
     */
    default RetryStrategy recoverableExceptionRetryStrategy() {
        return DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY;
    }

    /**
     * Strategy pacing retries of {@link #create} calls that failed with a recoverable exception.
     *
     * <p>Defaults to {@link #DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY}.
     *
     * @return the create retry strategy
     */
    default RetryStrategy createCommitterExceptionRetryStrategy() {
        return DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY;
    }

    /**
     * Creates the filter deciding which topics get committers. Called once per factory.
     *
     * @return the topic filter
     */
    default TopicFilter createTopicFilter() {
        return TopicFilter.ACCEPT_ALL;
    }

    /**
     * Called once, synchronously, during host shutdown after every committer is closed. Not
     * guarded against concurrent access to shared state; bounded by the host's
     * graceful-shutdown timeout.
     */
    @Override
    default void close() {
    }
}
