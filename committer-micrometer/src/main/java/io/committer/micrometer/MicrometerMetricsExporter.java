package io.committer.micrometer;

import io.committer.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code committer.commit.success} - batches fully committed</li>
 *   <li>{@code committer.commit.partial} - commits answered with a partial retry batch</li>
 *   <li>{@code committer.commit.failure} - recoverable commit failures (will retry)</li>
 *   <li>{@code committer.unrecoverable} - units stopped or attachments abandoned</li>
 *   <li>{@code committer.heartbeat} - heartbeats delivered</li>
 *   <li>{@code committer.create.failure} - recoverable creation failures (will retry)</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code committer.units.active} - units currently attached</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code committer.commit.duration.ms} - time spent in a single commit call</li>
 *   <li>{@code committer.commit.batch.size} - messages handed to a single commit call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter commitSuccess;
    private final Counter commitPartialRetry;
    private final Counter commitFailure;
    private final Counter unrecoverable;
    private final Counter heartbeat;
    private final Counter createFailure;
    private final Gauge activeUnitsGauge;
    private final DistributionSummary commitDuration;
    private final DistributionSummary batchSize;

    private final AtomicInteger activeUnits = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "committer"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "committer");
    }

    /**
     * Creates an exporter with a custom metric name prefix for hosts sharing a registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.committer"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.commitSuccess = Counter.builder(namePrefix + ".commit.success")
                .description("Batches fully committed")
                .register(registry);
        this.commitPartialRetry = Counter.builder(namePrefix + ".commit.partial")
                .description("Commits answered with a partial retry batch")
                .register(registry);
        this.commitFailure = Counter.builder(namePrefix + ".commit.failure")
                .description("Recoverable commit failures (will retry)")
                .register(registry);
        this.unrecoverable = Counter.builder(namePrefix + ".unrecoverable")
                .description("Units stopped by an unrecoverable failure")
                .register(registry);
        this.heartbeat = Counter.builder(namePrefix + ".heartbeat")
                .description("Heartbeats delivered to committers")
                .register(registry);
        this.createFailure = Counter.builder(namePrefix + ".create.failure")
                .description("Recoverable committer creation failures (will retry)")
                .register(registry);

        this.activeUnitsGauge = Gauge.builder(namePrefix + ".units.active", activeUnits, AtomicInteger::get)
                .description("Units currently attached")
                .register(registry);

        this.commitDuration = DistributionSummary.builder(namePrefix + ".commit.duration.ms")
                .description("Commit call duration in milliseconds")
                .register(registry);
        this.batchSize = DistributionSummary.builder(namePrefix + ".commit.batch.size")
                .description("Messages per commit call")
                .register(registry);
    }

    @Override
    public void incrementCommitSuccess() {
        if (closed) return;
        commitSuccess.increment();
    }

    @Override
    public void incrementCommitPartialRetry() {
        if (closed) return;
        commitPartialRetry.increment();
    }

    @Override
    public void incrementCommitFailure() {
        if (closed) return;
        commitFailure.increment();
    }

    @Override
    public void incrementUnrecoverable() {
        if (closed) return;
        unrecoverable.increment();
    }

    @Override
    public void incrementHeartbeat() {
        if (closed) return;
        heartbeat.increment();
    }

    @Override
    public void incrementCreateFailure() {
        if (closed) return;
        createFailure.increment();
    }

    @Override
    public void recordActiveUnits(int activeUnits) {
        if (closed) return;
        this.activeUnits.set(activeUnits);
    }

    @Override
    public void recordCommitDurationMs(long durationMs) {
        if (closed) return;
        commitDuration.record(durationMs);
    }

    @Override
    public void recordBatchSize(int size) {
        if (closed) return;
        batchSize.record(size);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>{@link io.committer.host.CommitterHost#close()} calls this, so a closed host leaves no
     * stale gauges behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(commitSuccess, commitPartialRetry, commitFailure,
                unrecoverable, heartbeat, createFailure,
                activeUnitsGauge, commitDuration, batchSize)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
