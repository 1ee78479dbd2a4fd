package io.committer.host;

import io.committer.AsyncCommitterFactory;
import io.committer.Committer;
import io.committer.CommitterFactory;
import io.committer.CommitterKey;
import io.committer.TopicFilter;
import io.committer.retry.RetryStrategy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Host-side wrapper around the process-wide {@link CommitterFactory}.
 *
 * <p>Supplies the asynchronous creation path for factories that only implement
 * {@link CommitterFactory#create}: each call runs on the given executor while holding the
 * adapter's create lock, so at most one {@code create} runs at a time. Factories implementing
 * {@link AsyncCommitterFactory} are called directly and the lock is not used.
 *
 * <p>Retry strategies and the topic filter are read from the factory once, at construction.
 *
 * <p>This class is thread-safe.
 */
public final class CommitterFactoryAdapter implements AutoCloseable {
    private final CommitterFactory factory;
    private final Lock createLock;
    private final RetryStrategy noDataBackoffStrategy;
    private final RetryStrategy recoverableExceptionRetryStrategy;
    private final RetryStrategy createCommitterExceptionRetryStrategy;
    private final TopicFilter topicFilter;

    public CommitterFactoryAdapter(CommitterFactory factory) {
        this(factory, new ReentrantLock());
    }

    /**
     * @param factory    the factory to wrap
     * @param createLock lock serializing synchronous {@code create} calls
     */
    public CommitterFactoryAdapter(CommitterFactory factory, Lock createLock) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.createLock = Objects.requireNonNull(createLock, "createLock");
        this.noDataBackoffStrategy = Objects.requireNonNull(
                factory.noDataBackoffStrategy(), "noDataBackoffStrategy");
        this.recoverableExceptionRetryStrategy = Objects.requireNonNull(
                factory.recoverableExceptionRetryStrategy(), "recoverableExceptionRetryStrategy");
        this.createCommitterExceptionRetryStrategy = Objects.requireNonNull(
                factory.createCommitterExceptionRetryStrategy(), "createCommitterExceptionRetryStrategy");
        this.topicFilter = Objects.requireNonNull(factory.createTopicFilter(), "topicFilter");
    }

    /**
     * Creates the committer for a unit. The returned future never completes exceptionally.
     *
     * @param key      the unit
     * @param executor executor running synchronous {@code create} calls
     * @return the outcome of the creation
     */
    public CompletableFuture<Attempt<Committer>> createAsync(CommitterKey key, Executor executor) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(executor, "executor");
        CompletableFuture<Committer> creation;
        try {
            if (factory instanceof AsyncCommitterFactory) {
                CompletionStage<Committer> stage = ((AsyncCommitterFactory) factory)
                        .createAsync(key.topic(), key.partition(), key.id(), executor);
                creation = stage == null
                        ? CompletableFuture.failedFuture(new IllegalStateException("createAsync returned null"))
                        : stage.toCompletableFuture();
            } else {
                creation = CompletableFuture.supplyAsync(() -> createSerialized(key), executor);
            }
        } catch (Throwable t) {
            creation = CompletableFuture.failedFuture(t);
        }
        return creation.<Attempt<Committer>>handle((committer, error) -> {
            if (error != null) {
                return Attempt.failed(error);
            }
            if (committer == null) {
                return Attempt.failed(new IllegalStateException("Factory returned a null committer for " + key));
            }
            return Attempt.succeeded(committer);
        });
    }

    private Committer createSerialized(CommitterKey key) {
        createLock.lock();
        try {
            return factory.create(key.topic(), key.partition(), key.id());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        } finally {
            createLock.unlock();
        }
    }

    public boolean isAsync() {
        return factory instanceof AsyncCommitterFactory;
    }

    public RetryStrategy noDataBackoffStrategy() {
        return noDataBackoffStrategy;
    }

    public RetryStrategy recoverableExceptionRetryStrategy() {
        return recoverableExceptionRetryStrategy;
    }

    public RetryStrategy createCommitterExceptionRetryStrategy() {
        return createCommitterExceptionRetryStrategy;
    }

    public TopicFilter topicFilter() {
        return topicFilter;
    }

    public CommitterFactory factory() {
        return factory;
    }

    @Override
    public void close() {
        factory.close();
    }
}
