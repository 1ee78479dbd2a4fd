package io.committer;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which topics the host binds committers to.
 *
 * <p>Created once per factory through {@link CommitterFactory#createTopicFilter()} and never
 * changed afterwards. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface TopicFilter {

    /** Filter accepting every topic. */
    TopicFilter ACCEPT_ALL = topic -> true;

    /**
     * @param topic the topic name
     * @return {@code true} if the topic should get committers
     */
    boolean accepts(String topic);

    /**
     * Accepts topics whose whole name matches {@code pattern}.
     */
    static TopicFilter matching(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return topic -> pattern.matcher(topic).matches();
    }

    /**
     * Accepts exactly the given topics.
     */
    static TopicFilter allowing(Collection<String> topics) {
        Set<String> allowed = Set.copyOf(Objects.requireNonNull(topics, "topics"));
        return allowed::contains;
    }

    default TopicFilter and(TopicFilter other) {
        Objects.requireNonNull(other, "other");
        return topic -> accepts(topic) && other.accepts(topic);
    }

    default TopicFilter negate() {
        return topic -> !accepts(topic);
    }
}
