package io.committer;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * A {@link CommitterFactory} that creates committers asynchronously.
 *
 * <p>When a factory implements this interface the host calls {@link #createAsync} and never
 * calls {@link #create}. The host's serializing lock no longer applies: {@code createAsync}
 * is invoked from several threads at once. The recommended {@code create} implementation is:
 *
 * <pre>{@code
 * @Override
 * public Committer create(String topic, int partition, int id) {
 *     throw new UnrecoverableCommitterFactoryException("Synchronous create should never be called");
 * }
 * }</pre>
 */
public interface AsyncCommitterFactory extends CommitterFactory {

    /**
     * Starts creating a committer. A failed stage is handled like an exception thrown from
     * {@link #create}.
     *
     * @param topic     the topic the committer is bound to
     * @param partition the partition the committer is bound to
     * @param id        the committer id within the partition
     * @param executor  executor shared by the host, usable for blocking work
     * @return a stage completing with the new committer
     */
    CompletionStage<Committer> createAsync(String topic, int partition, int id, Executor executor);
}
