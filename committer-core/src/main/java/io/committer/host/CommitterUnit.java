package io.committer.host;

import io.committer.CommitResult;
import io.committer.Committer;
import io.committer.CommitterFactory;
import io.committer.CommitterKey;
import io.committer.Message;
import io.committer.UnrecoverableCommitterException;
import io.committer.retry.RetryStrategy;
import io.committer.retry.RetryTracker;
import io.committer.spi.InMemoryMetadataStore;
import io.committer.spi.MetadataStore;
import io.committer.spi.MetricsExporter;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one {@link Committer} for a single (topic, partition, id) unit and applies the
 * commit-outcome protocol to every batch it is given.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>{@link CommitResult.Committed}: the metadata is stored and the batch future completes.</li>
 *   <li>{@link CommitResult.RetryBatch}: the metadata is stored immediately and only the returned
 *       sub-batch is re-sent after the outcome's own delay. The failure count is not touched.</li>
 *   <li>Recoverable failure: the full batch given to {@link #commit} is re-sent after a delay from
 *       the recoverable-exception strategy, even if an earlier {@code RetryBatch} narrowed it.
 *       When the strategy is exhausted the unit fails.</li>
 *   <li>Unrecoverable failure: the unit fails. Pending retries are cancelled, the batch future
 *       completes exceptionally and no further commit or heartbeat is issued.</li>
 * </ul>
 *
 * <h2>Idle Handling</h2>
 * <p>{@link #heartbeatIfDue()} calls the committer's heartbeat when the unit is idle and neither
 * a commit nor a heartbeat started within the last heartbeat cadence. {@link #recordEmptyPoll()}
 * returns how long to wait before the next poll according to the no-data backoff strategy.
 *
 * <p>Only one batch is in flight at a time, and commit, heartbeat and close calls on the
 * committer never overlap. This class is thread-safe.
 *
 * @see CommitterHost
 */
public final class CommitterUnit implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CommitterUnit.class.getName());

    public enum State {
        /** Ready to accept a batch or a heartbeat. */
        IDLE,
        /** A batch is being committed or waiting for a retry. */
        COMMITTING,
        /** A heartbeat is running. */
        HEARTBEATING,
        /** Stopped by an unrecoverable failure. Terminal. */
        FAILED,
        /** Closed. Terminal. */
        CLOSED
    }

    private final CommitterKey key;
    private final CommitterAdapter committer;
    private final RetryStrategy noDataBackoffStrategy;
    private final RetryTracker commitRetries;
    private final MetadataStore metadataStore;
    private final MetricsExporter metrics;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final Clock clock;
    private final long heartbeatCadenceMs;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private State state = State.IDLE;
    private String metadata;
    private Throwable failure;
    private CompletableFuture<Void> pendingBatch;
    private List<Message> originalBatch;
    private int callsInFlight;
    private Future<?> pendingRetry;
    private long lastCommitStartMs;
    private long lastHeartbeatMs;
    private int emptyPolls;

    private CommitterUnit(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key");
        this.committer = new CommitterAdapter(key, Objects.requireNonNull(builder.committer, "committer"));
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.noDataBackoffStrategy = builder.noDataBackoffStrategy != null
                ? builder.noDataBackoffStrategy : CommitterFactory.DEFAULT_NO_DATA_BACKOFF_STRATEGY;
        RetryStrategy recoverable = builder.recoverableExceptionRetryStrategy != null
                ? builder.recoverableExceptionRetryStrategy
                : CommitterFactory.DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY;
        this.commitRetries = new RetryTracker(recoverable, clock);
        this.metadataStore = builder.metadataStore != null ? builder.metadataStore : new InMemoryMetadataStore();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        if (builder.heartbeatCadenceMs < 0) {
            throw new IllegalArgumentException("heartbeatCadenceMs must be >= 0, got: " + builder.heartbeatCadenceMs);
        }
        this.heartbeatCadenceMs = builder.heartbeatCadenceMs;

        this.metadata = metadataStore.load(key).orElse(null);
        long now = clock.millis();
        this.lastCommitStartMs = now;
        this.lastHeartbeatMs = now;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Commits a batch, retrying as the outcomes dictate until every message is committed.
     *
     * <p>The returned future completes normally once the whole batch is committed. It completes
     * exceptionally with the unrecoverable failure if the unit fails, with a
     * {@link CancellationException} if the unit is closed first, or with an
     * {@link IllegalStateException} if the unit is not {@link State#IDLE}.
     *
     * @param batch messages to commit, in log order
     * @return a future tracking the batch
     * @throws IllegalArgumentException if the batch is empty
     */
    public CompletableFuture<Void> commit(List<Message> batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one message");
        }
        List<Message> messages = List.copyOf(batch);
        CompletableFuture<Void> result = new CompletableFuture<>();
        synchronized (this) {
            if (state == State.FAILED) {
                return CompletableFuture.failedFuture(failure);
            }
            if (state != State.IDLE) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Unit " + key + " cannot accept a batch while " + state));
            }
            state = State.COMMITTING;
            pendingBatch = result;
            originalBatch = messages;
            emptyPolls = 0;
            commitRetries.reset();
        }
        attempt(messages);
        return result;
    }

    private void attempt(List<Message> batch) {
        String currentMetadata;
        long startedAt;
        synchronized (this) {
            if (state != State.COMMITTING) {
                return;
            }
            pendingRetry = null;
            currentMetadata = metadata;
            startedAt = clock.millis();
            lastCommitStartMs = startedAt;
            callsInFlight++;
        }
        CompletableFuture<Attempt<CommitResult>> call;
        try {
            metrics.recordBatchSize(batch.size());
            call = committer.commitAsync(batch, currentMetadata, executor);
        } catch (RuntimeException e) {
            callFinished();
            fail(e);
            return;
        }
        call.thenAccept(outcome -> {
            try {
                onCommitAttempt(batch, outcome, startedAt);
            } catch (Throwable t) {
                fail(t);
            } finally {
                callFinished();
            }
        });
    }

    private synchronized void callFinished() {
        callsInFlight--;
        notifyAll();
    }

    private void onCommitAttempt(List<Message> batch, Attempt<CommitResult> outcome, long startedAt) {
        metrics.recordCommitDurationMs(Math.max(0L, clock.millis() - startedAt));
        if (outcome instanceof Attempt.Failed<CommitResult> failed) {
            if (failed.isUnrecoverable()) {
                fail(failed.cause());
            } else {
                onRecoverableFailure(failed.cause());
            }
            return;
        }
        CommitResult result = ((Attempt.Succeeded<CommitResult>) outcome).value();
        if (result instanceof CommitResult.RetryBatch retry) {
            onRetryBatch(batch, retry);
        } else {
            onCommitted((CommitResult.Committed) result);
        }
    }

    private void onCommitted(CommitResult.Committed committed) {
        CompletableFuture<Void> done;
        synchronized (this) {
            if (state != State.COMMITTING) {
                return;
            }
            storeMetadata(committed.metadata());
            commitRetries.reset();
            state = State.IDLE;
            done = pendingBatch;
            pendingBatch = null;
            originalBatch = null;
        }
        metrics.incrementCommitSuccess();
        done.complete(null);
    }

    private void onRetryBatch(List<Message> batch, CommitResult.RetryBatch retry) {
        if (!isOrderedSubsequence(retry.batch(), batch)) {
            fail(new UnrecoverableCommitterException("RetryBatch for " + key
                    + " contains messages that are not an ordered sub-selection of the committed batch"));
            return;
        }
        long delayMs = retry.retryAfter().toMillis();
        synchronized (this) {
            if (state != State.COMMITTING) {
                return;
            }
            storeMetadata(retry.metadata());
            commitRetries.waitFor(delayMs);
            pendingRetry = scheduleRetry(retry.batch(), delayMs);
        }
        metrics.incrementCommitPartialRetry();
        logger.log(Level.FINE, () -> "Partial commit for " + key + "; re-sending " + retry.batch().size()
                + " of " + batch.size() + " messages in " + delayMs + "ms");
    }

    private void onRecoverableFailure(Throwable cause) {
        List<Message> batch;
        int attempts;
        long delayMs;
        synchronized (this) {
            if (state != State.COMMITTING) {
                return;
            }
            batch = originalBatch;
            if (commitRetries.recordFailure() == RetryTracker.State.EXHAUSTED) {
                attempts = -1;
                delayMs = 0L;
            } else {
                attempts = commitRetries.attempts();
                delayMs = commitRetries.lastDelayMs();
                pendingRetry = scheduleRetry(batch, delayMs);
            }
        }
        if (attempts < 0) {
            fail(new UnrecoverableCommitterException("Commit retries exhausted for " + key + " after "
                    + commitRetries.attempts() + " attempts", cause));
            return;
        }
        metrics.incrementCommitFailure();
        logger.log(Level.WARNING, "Commit failed for " + key + " (attempt " + attempts + "); re-sending "
                + batch.size() + " messages in " + delayMs + "ms", cause);
    }

    // Caller holds the monitor
    private Future<?> scheduleRetry(List<Message> batch, long delayMs) {
        try {
            return scheduler.schedule(() -> attempt(batch), delayMs);
        } catch (RejectedExecutionException e) {
            // Scheduler is shutting down; fail on a separate path once the monitor is released
            CompletableFuture.runAsync(() -> fail(e), executor);
            return null;
        }
    }

    // Caller holds the monitor
    private void storeMetadata(String value) {
        metadataStore.save(key, value);
        metadata = value;
    }

    /**
     * Delivers a heartbeat if one is due.
     *
     * <p>A heartbeat is due when heartbeats are enabled, the unit is {@link State#IDLE}, and at
     * least one cadence has passed since the last commit attempt started and since the last
     * heartbeat. The metadata returned by the committer is stored. A recoverable heartbeat
     * failure keeps the previous metadata; an unrecoverable one fails the unit.
     *
     * @return {@code true} if the committer's heartbeat was invoked
     */
    public boolean heartbeatIfDue() {
        if (heartbeatCadenceMs <= 0) {
            return false;
        }
        String currentMetadata;
        synchronized (this) {
            if (state != State.IDLE) {
                return false;
            }
            long now = clock.millis();
            if (now - lastCommitStartMs < heartbeatCadenceMs || now - lastHeartbeatMs < heartbeatCadenceMs) {
                return false;
            }
            state = State.HEARTBEATING;
            lastHeartbeatMs = now;
            currentMetadata = metadata;
            callsInFlight++;
        }
        try {
            deliverHeartbeat(currentMetadata);
        } finally {
            callFinished();
        }
        return true;
    }

    private void deliverHeartbeat(String currentMetadata) {
        Attempt<String> outcome = committer.heartbeat(currentMetadata);
        if (outcome instanceof Attempt.Failed<String> failed && failed.isUnrecoverable()) {
            fail(failed.cause());
            return;
        }
        try {
            synchronized (this) {
                if (state == State.HEARTBEATING && outcome instanceof Attempt.Succeeded<String> succeeded) {
                    storeMetadata(succeeded.value());
                }
            }
        } catch (RuntimeException e) {
            fail(e);
            return;
        } finally {
            synchronized (this) {
                if (state == State.HEARTBEATING) {
                    state = State.IDLE;
                }
            }
        }
        if (outcome instanceof Attempt.Failed<String> failed) {
            logger.log(Level.WARNING, "Heartbeat failed for " + key + "; keeping previous metadata", failed.cause());
        } else {
            metrics.incrementHeartbeat();
        }
    }

    /**
     * Records a poll that returned no data.
     *
     * @return milliseconds to wait before polling again, from the no-data backoff strategy
     */
    public synchronized long recordEmptyPoll() {
        if (emptyPolls < Integer.MAX_VALUE) {
            emptyPolls++;
        }
        return Math.max(0L, noDataBackoffStrategy.computeDelayMs(emptyPolls));
    }

    /**
     * Records that data is available again, restarting the no-data backoff.
     */
    public synchronized void recordDataAvailable() {
        emptyPolls = 0;
    }

    private void fail(Throwable cause) {
        CompletableFuture<Void> batch;
        synchronized (this) {
            if (state == State.FAILED || state == State.CLOSED) {
                return;
            }
            state = State.FAILED;
            failure = cause;
            cancelPendingRetry();
            batch = pendingBatch;
            pendingBatch = null;
            originalBatch = null;
        }
        metrics.incrementUnrecoverable();
        logger.log(Level.SEVERE, "Unit " + key + " stopped by unrecoverable failure", cause);
        if (batch != null) {
            batch.completeExceptionally(cause);
        }
        terminated.completeExceptionally(cause);
    }

    // Caller holds the monitor
    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
    }

    /**
     * Stops the unit and closes its committer.
     *
     * <p>Pending retries are cancelled and a batch still in progress completes with a
     * {@link CancellationException}. If a commit or heartbeat call is running, this method
     * waits for it to return before closing the committer. Idempotent.
     */
    @Override
    public void close() {
        CompletableFuture<Void> batch;
        synchronized (this) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            cancelPendingRetry();
            batch = pendingBatch;
            pendingBatch = null;
            originalBatch = null;
            awaitCallsInFlight();
        }
        if (batch != null) {
            batch.completeExceptionally(new CancellationException("Unit " + key + " closed before the batch was committed"));
        }
        try {
            committer.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Committer close failed for " + key, e);
        }
        terminated.complete(null);
    }

    // Caller holds the monitor
    private void awaitCallsInFlight() {
        while (callsInFlight > 0) {
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.log(Level.WARNING, "Interrupted while waiting for a running call on " + key
                        + "; closing the committer anyway");
                return;
            }
        }
    }

    static boolean isOrderedSubsequence(List<Message> candidate, List<Message> batch) {
        int position = 0;
        for (Message message : candidate) {
            while (position < batch.size() && !batch.get(position).equals(message)) {
                position++;
            }
            if (position == batch.size()) {
                return false;
            }
            position++;
        }
        return true;
    }

    public CommitterKey key() {
        return key;
    }

    public synchronized State state() {
        return state;
    }

    /**
     * Returns the metadata stored by the last commit or heartbeat.
     *
     * @return the metadata, or {@code null}
     */
    public synchronized String metadata() {
        return metadata;
    }

    public synchronized Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /** Number of recoverable failures recorded for the batch in progress. */
    public synchronized int failedAttempts() {
        return commitRetries.attempts();
    }

    /** Current retry state of the batch in progress. */
    public synchronized RetryTracker.State retryState() {
        return commitRetries.state();
    }

    public synchronized boolean hasPendingRetry() {
        return pendingRetry != null && !pendingRetry.isDone();
    }

    /**
     * Returns a future that completes normally when the unit is closed, or exceptionally with
     * the failure when the unit fails.
     *
     * @return the termination future
     */
    public CompletableFuture<Void> terminated() {
        return terminated.copy();
    }

    boolean isAsyncCommitter() {
        return committer.isAsync();
    }

    @Override
    public String toString() {
        return "CommitterUnit{key=" + key + ", state=" + state() + '}';
    }

    /** Builder for {@link CommitterUnit}. */
    public static final class Builder {
        private CommitterKey key;
        private Committer committer;
        private RetryStrategy noDataBackoffStrategy;
        private RetryStrategy recoverableExceptionRetryStrategy;
        private MetadataStore metadataStore;
        private MetricsExporter metrics;
        private TaskScheduler scheduler;
        private Executor executor;
        private Clock clock;
        private long heartbeatCadenceMs;

        private Builder() {}

        /**
         * Sets the identity of the unit.
         *
         * <p><b>Required.</b>
         *
         * @param key the unit
         * @return this builder
         */
        public Builder key(CommitterKey key) {
            this.key = key;
            return this;
        }

        /**
         * Sets the committer the unit drives.
         *
         * <p><b>Required.</b>
         *
         * @param committer the committer
         * @return this builder
         */
        public Builder committer(Committer committer) {
            this.committer = committer;
            return this;
        }

        /**
         * Sets the strategy pacing polls while the log has no data.
         *
         * <p>Optional. Defaults to {@link CommitterFactory#DEFAULT_NO_DATA_BACKOFF_STRATEGY}.
         *
         * @param strategy the no-data backoff strategy
         * @return this builder
         */
        public Builder noDataBackoffStrategy(RetryStrategy strategy) {
            this.noDataBackoffStrategy = strategy;
            return this;
        }

        /**
         * Sets the strategy pacing retries after recoverable commit failures.
         *
         * <p>Optional. Defaults to {@link CommitterFactory#DEFAULT_RECOVERABLE_EXCEPTION_RETRY_STRATEGY}.
         *
         * @param strategy the commit retry strategy
         * @return this builder
         */
        public Builder recoverableExceptionRetryStrategy(RetryStrategy strategy) {
            this.recoverableExceptionRetryStrategy = strategy;
            return this;
        }

        /**
         * Sets where metadata is loaded from and saved to.
         *
         * <p>Optional. Defaults to a new {@link InMemoryMetadataStore}.
         *
         * @param metadataStore the metadata store
         * @return this builder
         */
        public Builder metadataStore(MetadataStore metadataStore) {
            this.metadataStore = metadataStore;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the scheduler running delayed retries.
         *
         * <p><b>Required.</b>
         *
         * @param scheduler the task scheduler
         * @return this builder
         */
        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Sets the executor running synchronous commits.
         *
         * <p><b>Required.</b>
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the clock used for heartbeat cadence and retry bookkeeping.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the heartbeat cadence in milliseconds.
         *
         * <p>Optional. Defaults to {@code 0}, which disables heartbeats.
         *
         * @param heartbeatCadenceMs cadence in milliseconds
         * @return this builder
         */
        public Builder heartbeatCadenceMs(long heartbeatCadenceMs) {
            this.heartbeatCadenceMs = heartbeatCadenceMs;
            return this;
        }

        /**
         * Builds the unit and loads its stored metadata.
         *
         * @return a new unit in state {@link State#IDLE}
         * @throws NullPointerException     if a required setting is missing
         * @throws IllegalArgumentException if {@code heartbeatCadenceMs < 0}
         */
        public CommitterUnit build() {
            return new CommitterUnit(this);
        }
    }
}
