package guraa.photoclean.repository;

import guraa.photoclean.model.FileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Wraps a cache so that a storage failure degrades the scan to uncached
 * operation instead of failing it. After the first failure the delegate is
 * no longer used.
 */
@Slf4j
public class FallbackFeatureCache implements FeatureCache {

    private final FeatureCache delegate;
    private final Consumer<String> warnings;
    private volatile boolean disabled;

    /**
     * @param delegate The real cache
     * @param warnings Receives one message per failure, for the scan result
     */
    public FallbackFeatureCache(FeatureCache delegate, Consumer<String> warnings) {
        this.delegate = delegate;
        this.warnings = warnings;
    }

    public boolean isDisabled() {
        return disabled;
    }

    @Override
    public void beginSession() {
        if (disabled) {
            return;
        }
        try {
            delegate.beginSession();
        } catch (DataAccessException e) {
            fail("begin session", e);
        }
    }

    @Override
    public Map<String, FileRecord> lookup(Collection<String> paths) {
        if (disabled) {
            return Collections.emptyMap();
        }
        try {
            return delegate.lookup(paths);
        } catch (DataAccessException e) {
            fail("lookup", e);
            return Collections.emptyMap();
        }
    }

    @Override
    public void upsert(Collection<FileRecord> records) {
        if (disabled) {
            return;
        }
        try {
            delegate.upsert(records);
        } catch (DataAccessException e) {
            fail("upsert", e);
        }
    }

    @Override
    public int finalizeSession(Collection<String> seenPaths, boolean purgeUnseen) {
        if (disabled) {
            return 0;
        }
        try {
            return delegate.finalizeSession(seenPaths, purgeUnseen);
        } catch (DataAccessException e) {
            fail("finalize session", e);
            return 0;
        }
    }

    @Override
    public void close() {
        try {
            delegate.close();
        } catch (DataAccessException e) {
            log.warn("Failed to close feature cache: {}", e.getMessage());
        }
    }

    private void fail(String operation, DataAccessException e) {
        disabled = true;
        String message = "Feature cache " + operation + " failed, continuing without cache: " + e.getMessage();
        log.warn(message, e);
        warnings.accept(message);
    }
}
