/**
 * Service provider interfaces for host integrations.
 *
 * <p>{@link io.committer.spi.MetadataStore} persists the metadata returned by committers;
 * {@link io.committer.spi.MetricsExporter} bridges host counters into a metrics backend.
 */
package io.committer.spi;
