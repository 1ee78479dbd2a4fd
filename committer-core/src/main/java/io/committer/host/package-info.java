/**
 * Runtime that binds committers to units and applies the commit-outcome protocol.
 *
 * <p>{@link io.committer.host.CommitterHost} creates committers through a
 * {@link io.committer.host.CommitterFactoryAdapter}, which serializes synchronous
 * {@code create} calls. Each unit is driven by a {@link io.committer.host.CommitterUnit}, which
 * retries, re-sends partial batches, delivers heartbeats and stops on unrecoverable failures.
 * Failures are classified once, when they leave a committer or factory, into an
 * {@link io.committer.host.Attempt} tagged with an {@link io.committer.host.ErrorKind}.
 *
 * @see io.committer.host.CommitterHost
 * @see io.committer.host.CommitterUnit
 */
package io.committer.host;
