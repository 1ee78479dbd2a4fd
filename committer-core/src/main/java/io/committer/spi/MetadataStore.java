package io.committer.spi;

import io.committer.CommitterKey;

import java.util.Optional;

/**
 * Persists the opaque metadata returned by committers alongside commit-position bookkeeping.
 *
 * <p>The host never interprets metadata: it saves whatever a commit or heartbeat returned and
 * hands the latest value back on the next call. Each key is written by one unit at a time.
 *
 * @see InMemoryMetadataStore
 */
public interface MetadataStore {

    /**
     * Loads the last saved metadata for a unit.
     *
     * @param key the unit
     * @return the metadata, or empty if none was saved
     */
    Optional<String> load(CommitterKey key);

    /**
     * Saves metadata for a unit, replacing any previous value.
     *
     * @param key      the unit
     * @param metadata the metadata, or {@code null} to clear it
     */
    void save(CommitterKey key, String metadata);
}
