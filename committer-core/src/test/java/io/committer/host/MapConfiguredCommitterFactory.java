package io.committer.host;

import io.committer.Committer;
import io.committer.CommitterFactory;

import java.util.Map;

/**
 * Factory loadable by class name.
 */
public final class MapConfiguredCommitterFactory implements CommitterFactory {
    final Map<String, String> config;

    public MapConfiguredCommitterFactory(Map<String, String> config) {
        if ("true".equals(config.get("fail"))) {
            throw new IllegalArgumentException("configured to fail");
        }
        this.config = config;
    }

    @Override
    public Committer create(String topic, int partition, int id) {
        return new RecordingCommitter();
    }
}
