package io.committer;

import java.util.List;

/**
 * Persists batches of messages for one (topic, partition, id) unit.
 *
 * <p>Implementations contain only the business logic of turning a batch into a durable side
 * effect. The host owns delivery, retry, backoff and lifecycle.
 *
 * <h2>Call Ordering</h2>
 * <p>The host never overlaps {@code commit}, {@code heartbeat} and {@code close} calls on the
 * same instance, so an implementation that keeps all of its state in instance fields needs
 * no locking. {@link AsyncCommitter} implementations may see overlapping commits and must
 * handle that themselves. {@link #close()} is always the last call.
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>Any exception other than {@link UnrecoverableException} is recoverable: the host
 *       re-sends the full original batch, even if an earlier retry narrowed it, after a delay from
 *       {@link CommitterFactory#recoverableExceptionRetryStrategy()}.</li>
 *   <li>{@link UnrecoverableCommitterException} stops the unit permanently.</li>
 *   <li>Returning {@link CommitResult.RetryBatch} is the only way to narrow what gets
 *       re-sent, and the narrowing applies to that retry only.</li>
 * </ul>
 *
 * <p>Delivery is at-least-once: a batch may be committed more than once after failures.
 *
 * @see CommitterFactory
 * @see CommitResult
 */
public interface Committer extends AutoCloseable {

    /**
     * Commits a batch of messages.
     *
     * <p>The list is non-empty, ordered by offset and unmodifiable. When the committer
     * implements {@link AsyncCommitter} the host never calls this method; such
     * implementations should throw {@link UnrecoverableCommitterException} here.
     *
     * @param batch    messages to commit
     * @param metadata metadata from the previous commit or heartbeat, or {@code null}
     * @return the outcome of the commit, never {@code null}
     * @throws Exception if the commit failed; retried unless it is an {@link UnrecoverableException}
     */
    CommitResult commit(List<Message> batch, String metadata) throws Exception;

    /**
     * Called when the host had nothing to deliver for a full heartbeat cadence.
     *
     * <p>Never called while a commit is in flight or in a cadence interval in which a commit
     * was started. The returned value is stored exactly like the metadata of a commit.
     *
     * @param metadata the current metadata, or {@code null}
     * @return the metadata to store, or {@code null}
     * @throws Exception if the heartbeat failed
     */
    default String heartbeat(String metadata) throws Exception {
        return metadata;
    }

    /**
     * Releases resources. Called once, synchronously, when the unit is torn down. The host
     * waits at most its graceful-shutdown timeout before moving on.
     */
    @Override
    default void close() {
    }
}
