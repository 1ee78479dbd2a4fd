package io.committer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result returned by {@link Committer#commit(List, String)} to tell the host what happened
 * to the batch.
 *
 * <ul>
 *   <li>{@link Committed} - the whole batch is durable; the host stores the metadata and
 *       moves on.</li>
 *   <li>{@link RetryBatch} - part of the batch is durable; the host stores the metadata right
 *       away and re-sends only {@link RetryBatch#batch()} after {@link RetryBatch#retryAfter()}.
 *       This delay replaces the factory's recoverable-exception strategy.</li>
 * </ul>
 *
 * <p>Throwing from {@code commit} is a different signal: the host then re-sends the full batch
 * of that call after a delay from
 * {@link CommitterFactory#recoverableExceptionRetryStrategy()}.
 *
 * @see Committer#commit(List, String)
 */
public sealed interface CommitResult permits CommitResult.Committed, CommitResult.RetryBatch {

    /**
     * Metadata to persist alongside the commit position.
     *
     * @return the metadata, or {@code null} for none
     */
    String metadata();

    /**
     * Returns a {@link Committed} result without metadata.
     *
     * @return the committed result
     */
    static Committed committed() {
        return Committed.EMPTY;
    }

    /**
     * Returns a {@link Committed} result carrying metadata.
     *
     * @param metadata metadata to persist, may be {@code null}
     * @return the committed result
     */
    static Committed committed(String metadata) {
        return metadata == null ? Committed.EMPTY : new Committed(metadata);
    }

    /**
     * Creates a {@link RetryBatch} result without metadata.
     *
     * @param retryAfter how long to wait before re-sending the remaining messages
     * @param batch      the messages still to commit (at least one)
     * @return the retry result
     * @throws IllegalArgumentException if {@code batch} is empty or {@code retryAfter} is negative
     */
    static RetryBatch retryBatch(Duration retryAfter, List<Message> batch) {
        return new RetryBatch(retryAfter, batch, null);
    }

    /**
     * Creates a {@link RetryBatch} result carrying metadata.
     *
     * @param retryAfter how long to wait before re-sending the remaining messages
     * @param batch      the messages still to commit (at least one)
     * @param metadata   metadata to persist immediately, may be {@code null}
     * @return the retry result
     * @throws IllegalArgumentException if {@code batch} is empty or {@code retryAfter} is negative
     */
    static RetryBatch retryBatch(Duration retryAfter, List<Message> batch, String metadata) {
        return new RetryBatch(retryAfter, batch, metadata);
    }

    /**
     * The entire batch was committed.
     *
     * @param metadata metadata to persist, may be {@code null}
     */
    record Committed(String metadata) implements CommitResult {
        static final Committed EMPTY = new Committed(null);
    }

    /**
     * Part of the batch was committed; the remaining messages must be re-sent.
     *
     * <p>The batch keeps the order of the original batch. It is usually a suffix of it but
     * may be any sub-selection.
     *
     * @param retryAfter delay before the host re-sends {@code batch} (not null, not negative)
     * @param batch      messages still to commit (not null, not empty, no null elements)
     * @param metadata   metadata to persist immediately, may be {@code null}
     */
    record RetryBatch(Duration retryAfter, List<Message> batch, String metadata) implements CommitResult {
        public RetryBatch {
            Objects.requireNonNull(retryAfter, "retryAfter");
            if (retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must not be negative");
            }
            if (batch == null || batch.isEmpty()) {
                throw new IllegalArgumentException("batch must contain at least one message");
            }
            batch = List.copyOf(batch);
        }
    }
}
