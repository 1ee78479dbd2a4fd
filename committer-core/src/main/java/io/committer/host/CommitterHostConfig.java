package io.committer.host;

import java.util.Map;
import java.util.Objects;

/**
 * Tunables for a {@link CommitterHost}.
 *
 * <p>Values can be set fluently or read from a flat string map with {@link #fromMap(Map)}.
 */
public final class CommitterHostConfig {
    public static final String HEARTBEAT_CADENCE_KEY = "heartbeatCadenceInMillis";
    public static final String GRACEFUL_SHUTDOWN_TIMEOUT_KEY = "gracefulShutdownTimeoutMillis";
    public static final String PARALLELISM_KEY = "parallelismFactor";
    public static final String WORKER_COUNT_KEY = "workerCount";

    private long heartbeatCadenceMs = 0L;
    private long gracefulShutdownTimeoutMs = 10_000L;
    private int parallelism = 1;
    private int workerCount = 4;

    /**
     * Reads the recognised keys from {@code properties}. Other keys are ignored and missing keys
     * keep their defaults.
     *
     * @param properties flat configuration
     * @return a new config
     * @throws IllegalArgumentException if a value is not a number or is out of range
     */
    public static CommitterHostConfig fromMap(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        CommitterHostConfig config = new CommitterHostConfig();
        String value = properties.get(HEARTBEAT_CADENCE_KEY);
        if (value != null) {
            config.setHeartbeatCadenceMs(parseLong(HEARTBEAT_CADENCE_KEY, value));
        }
        value = properties.get(GRACEFUL_SHUTDOWN_TIMEOUT_KEY);
        if (value != null) {
            config.setGracefulShutdownTimeoutMs(parseLong(GRACEFUL_SHUTDOWN_TIMEOUT_KEY, value));
        }
        value = properties.get(PARALLELISM_KEY);
        if (value != null) {
            config.setParallelism(parseInt(PARALLELISM_KEY, value));
        }
        value = properties.get(WORKER_COUNT_KEY);
        if (value != null) {
            config.setWorkerCount(parseInt(WORKER_COUNT_KEY, value));
        }
        return config;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + value, e);
        }
    }

    public long getHeartbeatCadenceMs() {
        return heartbeatCadenceMs;
    }

    /** {@code 0} disables heartbeats. */
    public CommitterHostConfig setHeartbeatCadenceMs(long heartbeatCadenceMs) {
        if (heartbeatCadenceMs < 0) {
            throw new IllegalArgumentException(HEARTBEAT_CADENCE_KEY + " must be >= 0, got: " + heartbeatCadenceMs);
        }
        this.heartbeatCadenceMs = heartbeatCadenceMs;
        return this;
    }

    public long getGracefulShutdownTimeoutMs() {
        return gracefulShutdownTimeoutMs;
    }

    public CommitterHostConfig setGracefulShutdownTimeoutMs(long gracefulShutdownTimeoutMs) {
        if (gracefulShutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                    GRACEFUL_SHUTDOWN_TIMEOUT_KEY + " must be >= 0, got: " + gracefulShutdownTimeoutMs);
        }
        this.gracefulShutdownTimeoutMs = gracefulShutdownTimeoutMs;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    /** Number of committer ids attached per partition by {@link CommitterHost#attachAll}. */
    public CommitterHostConfig setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException(PARALLELISM_KEY + " must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        return this;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public CommitterHostConfig setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException(WORKER_COUNT_KEY + " must be >= 1, got: " + workerCount);
        }
        this.workerCount = workerCount;
        return this;
    }

    @Override
    public String toString() {
        return "CommitterHostConfig{heartbeatCadenceMs=" + heartbeatCadenceMs
                + ", gracefulShutdownTimeoutMs=" + gracefulShutdownTimeoutMs
                + ", parallelism=" + parallelism
                + ", workerCount=" + workerCount + '}';
    }
}
