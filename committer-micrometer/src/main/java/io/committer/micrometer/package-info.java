/**
 * Micrometer bridge for exporting committer host metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.committer.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.committer.spi.MetricsExporter} SPI using Micrometer counters, gauges and
 * distribution summaries.
 *
 * @see io.committer.micrometer.MicrometerMetricsExporter
 */
package io.committer.micrometer;
