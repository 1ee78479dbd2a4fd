package io.committer.host;

import io.committer.AsyncCommitter;
import io.committer.CommitResult;
import io.committer.Committer;
import io.committer.CommitterKey;
import io.committer.Message;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Host-side wrapper around one {@link Committer}.
 *
 * <p>Supplies the asynchronous commit path for committers that only implement
 * {@link Committer#commit}: the call runs on the given executor. {@link AsyncCommitter}
 * implementations are called directly. Every outcome, including a {@code null} result, comes
 * back as an {@link Attempt}.
 */
public final class CommitterAdapter implements AutoCloseable {
    private final CommitterKey key;
    private final Committer committer;

    public CommitterAdapter(CommitterKey key, Committer committer) {
        this.key = Objects.requireNonNull(key, "key");
        this.committer = Objects.requireNonNull(committer, "committer");
    }

    /**
     * Commits a batch. The returned future never completes exceptionally.
     *
     * @param batch    messages to commit
     * @param metadata current metadata, or {@code null}
     * @param executor executor running synchronous commits
     * @return the outcome of the commit
     */
    public CompletableFuture<Attempt<CommitResult>> commitAsync(List<Message> batch, String metadata,
                                                                Executor executor) {
        CompletableFuture<CommitResult> call;
        try {
            if (committer instanceof AsyncCommitter) {
                CompletionStage<CommitResult> stage =
                        ((AsyncCommitter) committer).commitAsync(batch, metadata, executor);
                call = stage == null
                        ? CompletableFuture.failedFuture(new IllegalStateException("commitAsync returned null"))
                        : stage.toCompletableFuture();
            } else {
                call = CompletableFuture.supplyAsync(() -> commitSync(batch, metadata), executor);
            }
        } catch (Throwable t) {
            call = CompletableFuture.failedFuture(t);
        }
        return call.<Attempt<CommitResult>>handle((result, error) -> {
            if (error != null) {
                return Attempt.failed(error);
            }
            if (result == null) {
                return Attempt.failed(new IllegalStateException("Committer for " + key + " returned a null result"));
            }
            return Attempt.succeeded(result);
        });
    }

    private CommitResult commitSync(List<Message> batch, String metadata) {
        try {
            return committer.commit(batch, metadata);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    /**
     * Delivers a heartbeat on the calling thread.
     *
     * @param metadata current metadata, or {@code null}
     * @return the metadata returned by the committer, or the failure
     */
    public Attempt<String> heartbeat(String metadata) {
        try {
            return Attempt.succeeded(committer.heartbeat(metadata));
        } catch (Throwable t) {
            return Attempt.failed(t);
        }
    }

    public boolean isAsync() {
        return committer instanceof AsyncCommitter;
    }

    public CommitterKey key() {
        return key;
    }

    @Override
    public void close() {
        committer.close();
    }
}
