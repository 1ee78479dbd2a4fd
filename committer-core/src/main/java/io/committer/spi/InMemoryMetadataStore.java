package io.committer.spi;

import io.committer.CommitterKey;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed {@link MetadataStore}. Contents are lost on restart.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryMetadataStore implements MetadataStore {
    private final Map<CommitterKey, String> metadata = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(CommitterKey key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(metadata.get(key));
    }

    @Override
    public void save(CommitterKey key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    public int size() {
        return metadata.size();
    }
}
