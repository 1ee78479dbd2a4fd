/**
 * Contract between the committer host and pluggable committers that persist batches of log
 * messages to an external store.
 *
 * <h2>Core Design</h2>
 * <p>The host reads a log as (topic, partition) streams and hands ordered batches of
 * {@link io.committer.Message messages} to a {@link io.committer.Committer}. Each call returns a
 * {@link io.committer.CommitResult}: {@link io.committer.CommitResult.Committed Committed} when
 * the whole batch is durable, or {@link io.committer.CommitResult.RetryBatch RetryBatch} naming
 * the messages that must be re-sent after a delay. Both carry opaque metadata that the host
 * stores and passes back on the next call.
 *
 * <p>A thrown exception is recoverable and retried with the factory's
 * {@linkplain io.committer.CommitterFactory#recoverableExceptionRetryStrategy() retry strategy}.
 * Throwing {@link io.committer.UnrecoverableCommitterException} stops the unit instead.
 *
 * <h2>Implementing a Committer</h2>
 * <pre>{@code
 * public final class PrintingCommitterFactory implements CommitterFactory {
 *     public PrintingCommitterFactory(Map<String, String> config) {
 *     }
 *
 *     @Override
 *     public Committer create(String topic, int partition, int id) {
 *         return (batch, metadata) -> {
 *             batch.forEach(m -> System.out.println(m.payloadAsString()));
 *             return CommitResult.committed(metadata);
 *         };
 *     }
 * }
 * }</pre>
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>committer-core</b> - contract, retry strategies, host (zero external deps)</li>
 *   <li><b>committer-micrometer</b> - optional {@linkplain io.committer.micrometer Micrometer
 *       metrics bridge}</li>
 * </ul>
 *
 * @see io.committer.Committer
 * @see io.committer.CommitterFactory
 * @see io.committer.CommitResult
 * @see io.committer.host.CommitterHost
 */
package io.committer;
