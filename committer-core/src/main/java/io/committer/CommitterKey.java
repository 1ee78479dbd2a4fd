package io.committer;

import java.util.Objects;

/**
 * Identity of one processing unit: a topic, one of its partitions, and the id of the
 * committer instance within that partition.
 *
 * <p>With a parallelism factor of {@code n} the host binds {@code n} committers to every
 * (topic, partition) pair, with ids {@code 0} through {@code n - 1}.
 *
 * @param topic     the log topic
 * @param partition the partition of the topic
 * @param id        the committer id within the partition
 */
public record CommitterKey(String topic, int partition, int id) {

    public CommitterKey {
        Objects.requireNonNull(topic, "topic");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (partition < 0) {
            throw new IllegalArgumentException("partition must be >= 0, got: " + partition);
        }
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got: " + id);
        }
    }

    @Override
    public String toString() {
        return topic + "-" + partition + "#" + id;
    }
}
