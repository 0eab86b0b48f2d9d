package guraa.photoclean.repository;

import guraa.photoclean.model.FileRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Cache that stores nothing. Used when caching is disabled or the cache file cannot be opened.
 */
public class NoOpFeatureCache implements FeatureCache {

    @Override
    public void beginSession() {
    }

    @Override
    public Map<String, FileRecord> lookup(Collection<String> paths) {
        return Collections.emptyMap();
    }

    @Override
    public void upsert(Collection<FileRecord> records) {
    }

    @Override
    public int finalizeSession(Collection<String> seenPaths, boolean purgeUnseen) {
        return 0;
    }

    @Override
    public void close() {
    }
}
