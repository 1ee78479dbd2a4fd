package io.committer;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * A {@link Committer} that commits asynchronously.
 *
 * <p>When a committer implements this interface the host calls {@link #commitAsync} instead of
 * {@link #commit}. Thread safety becomes the implementer's responsibility: commits may
 * overlap if the host issues them concurrently, and the returned stage may complete on any
 * thread.
 *
 * <p>A failed stage is handled like an exception thrown from {@code commit}.
 */
public interface AsyncCommitter extends Committer {

    /**
     * Starts committing a batch.
     *
     * @param batch    messages to commit (non-empty, ordered, unmodifiable)
     * @param metadata metadata from the previous commit or heartbeat, or {@code null}
     * @param executor executor shared by all committers of the host, usable for blocking work
     * @return a stage completing with the commit outcome
     */
    CompletionStage<CommitResult> commitAsync(List<Message> batch, String metadata, Executor executor);
}
