package io.committer.host;

import io.committer.Committer;
import io.committer.CommitterFactory;
import io.committer.CommitterKey;
import io.committer.UnrecoverableCommitterFactoryException;
import io.committer.retry.RetryTracker;
import io.committer.spi.InMemoryMetadataStore;
import io.committer.spi.MetadataStore;
import io.committer.spi.MetricsExporter;
import io.committer.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds committers to (topic, partition, id) units and owns their lifecycle.
 *
 * <p>{@link #attach} asks the factory for a committer, retrying failed creations with the
 * factory's create-committer strategy, and wraps the result in a {@link CommitterUnit}.
 * Synchronous factories are called one at a time through the create lock. A unit stopped by an
 * unrecoverable failure is detached and its committer closed. When heartbeats are enabled the
 * host checks every unit on a timer and delivers the heartbeats that are due.
 *
 * <p>{@link #close()} closes all units in parallel, waiting for running commits up to the
 * graceful shutdown timeout, then closes the factory and the host's own thread pools.
 *
 * <pre>{@code
 * try (CommitterHost host = CommitterHost.builder()
 *         .factory(committerFactory)
 *         .config(new CommitterHostConfig().setHeartbeatCadenceMs(30_000))
 *         .build()) {
 *     CommitterUnit unit = host.attach("orders", 0, 0).join().orElseThrow();
 *     unit.commit(batch).join();
 * }
 * }</pre>
 */
public final class CommitterHost implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CommitterHost.class.getName());

    private final CommitterFactoryAdapter factory;
    private final CommitterHostConfig config;
    private final MetadataStore metadataStore;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Executor executor;
    private final ExecutorService ownedWorkers;
    private final TaskScheduler scheduler;
    private final ExecutorTaskScheduler ownedScheduler;
    private final ExecutorService closer;

    private final ConcurrentMap<CommitterKey, CompletableFuture<Optional<CommitterUnit>>> attachments =
            new ConcurrentHashMap<>();
    private final ConcurrentMap<CommitterKey, CommitterUnit> units = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private CommitterHost(Builder builder) {
        CommitterFactory committerFactory = Objects.requireNonNull(builder.factory, "factory");
        this.factory = builder.createLock != null
                ? new CommitterFactoryAdapter(committerFactory, builder.createLock)
                : new CommitterFactoryAdapter(committerFactory);
        this.config = builder.config != null ? builder.config : new CommitterHostConfig();
        this.metadataStore = builder.metadataStore != null ? builder.metadataStore : new InMemoryMetadataStore();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownedWorkers = null;
        } else {
            this.ownedWorkers = Executors.newFixedThreadPool(
                    config.getWorkerCount(), new DaemonThreadFactory("committer-worker-"));
            this.executor = ownedWorkers;
        }
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownedScheduler = null;
        } else {
            this.ownedScheduler = ExecutorTaskScheduler.singleThreaded("committer-retry-");
            this.scheduler = ownedScheduler;
        }
        this.closer = Executors.newCachedThreadPool(new DaemonThreadFactory("committer-closer-"));

        if (config.getHeartbeatCadenceMs() > 0) {
            scheduleHeartbeatTick();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder from flat configuration: the factory is loaded with
     * {@link CommitterFactories#fromProperties(Map)} and the tunables with
     * {@link CommitterHostConfig#fromMap(Map)}.
     *
     * @param properties host configuration
     * @return a builder with factory and config set
     */
    public static Builder fromProperties(Map<String, String> properties) {
        return builder()
                .factory(CommitterFactories.fromProperties(properties))
                .config(CommitterHostConfig.fromMap(properties));
    }

    /**
     * Attaches a committer to a unit.
     *
     * <p>Completes with an empty optional if the factory's topic filter rejects the topic. If the
     * unit is already attached or being attached, the same outcome is returned. Completes
     * exceptionally with {@link UnrecoverableCommitterFactoryException} if creation fails
     * unrecoverably or the create-committer strategy is exhausted.
     *
     * @param topic     log topic
     * @param partition partition within the topic
     * @param id        committer id within the partition
     * @return a future holding the attached unit
     */
    public CompletableFuture<Optional<CommitterUnit>> attach(String topic, int partition, int id) {
        CommitterKey key = new CommitterKey(topic, partition, id);
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Host is closed"));
        }
        if (!factory.topicFilter().accepts(topic)) {
            logger.log(Level.FINE, () -> "Topic filter rejected " + key);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<Optional<CommitterUnit>> created = new CompletableFuture<>();
        CompletableFuture<Optional<CommitterUnit>> existing = attachments.putIfAbsent(key, created);
        if (existing != null) {
            return existing.copy();
        }
        create(key, new RetryTracker(factory.createCommitterExceptionRetryStrategy(), clock), created);
        return created.copy();
    }

    /**
     * Attaches ids {@code 0} to {@code parallelism - 1} of a partition.
     *
     * @param topic     log topic
     * @param partition partition within the topic
     * @return a future holding the attached units, empty if the topic is rejected
     */
    public CompletableFuture<List<CommitterUnit>> attachAll(String topic, int partition) {
        List<CompletableFuture<Optional<CommitterUnit>>> pending = new ArrayList<>();
        for (int id = 0; id < config.getParallelism(); id++) {
            pending.add(attach(topic, partition, id));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<CommitterUnit> attached = new ArrayList<>();
                    for (CompletableFuture<Optional<CommitterUnit>> future : pending) {
                        future.join().ifPresent(attached::add);
                    }
                    return attached;
                });
    }

    private void create(CommitterKey key, RetryTracker tracker, CompletableFuture<Optional<CommitterUnit>> result) {
        if (closed || result.isDone()) {
            result.completeExceptionally(new CancellationException("Host closed while attaching " + key));
            return;
        }
        factory.createAsync(key, executor).thenAccept(outcome -> {
            try {
                onCreateAttempt(key, tracker, result, outcome);
            } catch (RuntimeException e) {
                attachFailed(key, result, new UnrecoverableCommitterFactoryException(
                        "Attaching " + key + " failed", e));
            }
        });
    }

    private void onCreateAttempt(CommitterKey key, RetryTracker tracker,
                                 CompletableFuture<Optional<CommitterUnit>> result, Attempt<Committer> outcome) {
        if (outcome instanceof Attempt.Succeeded<Committer> succeeded) {
            register(key, succeeded.value(), result);
            return;
        }
        Attempt.Failed<Committer> failed = (Attempt.Failed<Committer>) outcome;
        if (failed.isUnrecoverable()) {
            Throwable cause = failed.cause();
            attachFailed(key, result, cause instanceof UnrecoverableCommitterFactoryException e
                    ? e
                    : new UnrecoverableCommitterFactoryException("Creating committer for " + key + " failed", cause));
            return;
        }
        if (tracker.recordFailure() == RetryTracker.State.EXHAUSTED) {
            attachFailed(key, result, new UnrecoverableCommitterFactoryException("Committer creation retries exhausted for "
                    + key + " after " + tracker.attempts() + " attempts", failed.cause()));
            return;
        }
        long delayMs = tracker.lastDelayMs();
        metrics.incrementCreateFailure();
        logger.log(Level.WARNING, "Creating committer for " + key + " failed (attempt " + tracker.attempts()
                + "); retrying in " + delayMs + "ms", failed.cause());
        try {
            scheduler.schedule(() -> create(key, tracker, result), delayMs);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new CancellationException("Host closed while attaching " + key));
            attachments.remove(key, result);
        }
    }

    private void register(CommitterKey key, Committer committer, CompletableFuture<Optional<CommitterUnit>> result) {
        CommitterUnit unit;
        synchronized (this) {
            if (closed || result.isDone()) {
                unit = null;
            } else {
                unit = CommitterUnit.builder()
                        .key(key)
                        .committer(committer)
                        .noDataBackoffStrategy(factory.noDataBackoffStrategy())
                        .recoverableExceptionRetryStrategy(factory.recoverableExceptionRetryStrategy())
                        .metadataStore(metadataStore)
                        .metrics(metrics)
                        .scheduler(scheduler)
                        .executor(executor)
                        .clock(clock)
                        .heartbeatCadenceMs(config.getHeartbeatCadenceMs())
                        .build();
                units.put(key, unit);
            }
        }
        if (unit == null) {
            closeQuietly(key, committer);
            return;
        }
        metrics.recordActiveUnits(units.size());
        unit.terminated().whenComplete((ignored, failure) -> {
            if (failure != null) {
                detachAsync(key);
            }
        });
        result.complete(Optional.of(unit));
        logger.log(Level.INFO, "Attached committer for " + key);
    }

    private void attachFailed(CommitterKey key, CompletableFuture<Optional<CommitterUnit>> result,
                              UnrecoverableCommitterFactoryException failure) {
        metrics.incrementUnrecoverable();
        logger.log(Level.SEVERE, "Cannot attach committer for " + key, failure);
        result.completeExceptionally(failure);
        attachments.remove(key, result);
    }

    private void detachAsync(CommitterKey key) {
        try {
            closer.execute(() -> detach(key));
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Host closing; skipping detach of " + key, e);
        }
    }

    /**
     * Detaches a unit and closes it, waiting up to the graceful shutdown timeout for a running
     * commit.
     *
     * @param key the unit
     * @return {@code true} if the unit was attached
     */
    public boolean detach(CommitterKey key) {
        Objects.requireNonNull(key, "key");
        CommitterUnit unit;
        synchronized (this) {
            unit = units.remove(key);
            attachments.remove(key);
        }
        if (unit == null) {
            return false;
        }
        metrics.recordActiveUnits(units.size());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getGracefulShutdownTimeoutMs());
        awaitClose(unit.key().toString(), submitClose(unit::close), deadline);
        logger.log(Level.INFO, "Detached committer for " + key);
        return true;
    }

    public Optional<CommitterUnit> unit(CommitterKey key) {
        return Optional.ofNullable(units.get(key));
    }

    public Collection<CommitterUnit> units() {
        return List.copyOf(units.values());
    }

    /**
     * Delivers the heartbeats that are due on every attached unit, on the calling thread.
     *
     * @return number of heartbeats delivered
     */
    public int heartbeatAll() {
        int delivered = 0;
        for (CommitterUnit unit : units.values()) {
            if (unit.heartbeatIfDue()) {
                delivered++;
            }
        }
        return delivered;
    }

    private void scheduleHeartbeatTick() {
        long tickMs = Math.max(1L, config.getHeartbeatCadenceMs() / 2);
        try {
            scheduler.schedule(this::heartbeatTick, tickMs);
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Scheduler stopped; heartbeats disabled", e);
        }
    }

    private void heartbeatTick() {
        if (closed) {
            return;
        }
        for (CommitterUnit unit : units.values()) {
            try {
                executor.execute(unit::heartbeatIfDue);
            } catch (RejectedExecutionException e) {
                logger.log(Level.FINE, "Executor stopped; skipping heartbeat for " + unit.key(), e);
            }
        }
        scheduleHeartbeatTick();
    }

    public CommitterHostConfig config() {
        return config;
    }

    public CommitterFactoryAdapter factory() {
        return factory;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes all units in parallel, then the factory, the metrics exporter if it is
     * {@link AutoCloseable}, and the host's own thread pools. Running commits get up to the
     * graceful shutdown timeout to return. Idempotent.
     */
    @Override
    public void close() {
        List<CompletableFuture<Optional<CommitterUnit>>> pending;
        List<CommitterUnit> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            pending = new ArrayList<>(attachments.values());
            toClose = new ArrayList<>(units.values());
            attachments.clear();
            units.clear();
        }
        for (CompletableFuture<Optional<CommitterUnit>> attachment : pending) {
            attachment.completeExceptionally(new CancellationException("Host closed"));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getGracefulShutdownTimeoutMs());
        List<Future<?>> closing = new ArrayList<>();
        for (CommitterUnit unit : toClose) {
            closing.add(submitClose(unit::close));
        }
        for (int i = 0; i < toClose.size(); i++) {
            awaitClose(toClose.get(i).key().toString(), closing.get(i), deadline);
        }
        awaitClose("factory", submitClose(factory::close), deadline);
        metrics.recordActiveUnits(0);
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Closing metrics exporter failed", e);
            }
        }

        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
        if (ownedWorkers != null) {
            shutdown(ownedWorkers, deadline);
        }
        closer.shutdownNow();
        logger.log(Level.INFO, "Committer host closed; " + toClose.size() + " units closed");
    }

    private Future<?> submitClose(Runnable task) {
        try {
            return closer.submit(task);
        } catch (RejectedExecutionException e) {
            task.run();
            return CompletableFuture.completedFuture(null);
        }
    }

    private static void awaitClose(String name, Future<?> closing, long deadline) {
        try {
            closing.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            logger.log(Level.WARNING, "Closing " + name + " did not finish within the graceful shutdown timeout");
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, "Closing " + name + " failed", e.getCause());
        }
    }

    private static void shutdown(ExecutorService pool, long deadline) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(CommitterKey key, Committer committer) {
        try {
            committer.close();
        } catch (Exception e) {
            logger.log(Level.WARNING, "Closing unused committer for " + key + " failed", e);
        }
    }

    /** Builder for {@link CommitterHost}. */
    public static final class Builder {
        private CommitterFactory factory;
        private Lock createLock;
        private CommitterHostConfig config;
        private MetadataStore metadataStore;
        private MetricsExporter metrics;
        private TaskScheduler scheduler;
        private Executor executor;
        private Clock clock;

        private Builder() {}

        /** <b>Required.</b> The factory creating committers. */
        public Builder factory(CommitterFactory factory) {
            this.factory = factory;
            return this;
        }

        /** Optional. Lock serializing synchronous creates. Defaults to a new {@code ReentrantLock}. */
        public Builder createLock(Lock createLock) {
            this.createLock = createLock;
            return this;
        }

        /** Optional. Defaults to {@code new CommitterHostConfig()}. */
        public Builder config(CommitterHostConfig config) {
            this.config = config;
            return this;
        }

        /** Optional. Defaults to a new {@link InMemoryMetadataStore}. */
        public Builder metadataStore(MetadataStore metadataStore) {
            this.metadataStore = metadataStore;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Scheduler for delayed retries and heartbeat ticks. Defaults to a single daemon
         * thread owned and shut down by the host.
         */
        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Optional. Executor for synchronous creates, commits and heartbeats. Defaults to a fixed
         * pool of {@link CommitterHostConfig#getWorkerCount()} daemon threads owned by the host.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /** Optional. Defaults to {@link Clock#systemUTC()}. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CommitterHost build() {
            return new CommitterHost(this);
        }
    }
}
