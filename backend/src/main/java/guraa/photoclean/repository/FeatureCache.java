package guraa.photoclean.repository;

import guraa.photoclean.model.FileRecord;

import java.util.Collection;
import java.util.Map;

/**
 * Persistent store of per-file features, keyed by absolute path and
 * invalidated by the (modified time, size) signature.
 */
public interface FeatureCache extends AutoCloseable {

    /**
     * Fix the session timestamp used for every last-seen stamp of this scan.
     */
    void beginSession();

    /**
     * Fetch stored records.
     *
     * @param paths Paths to look up
     * @return Records by path; paths without a record are absent
     */
    Map<String, FileRecord> lookup(Collection<String> paths);

    /**
     * Store freshly extracted features. When the stored signature equals the
     * record's, features the record does not carry are preserved; when it differs
     * they are cleared, because they describe old content.
     *
     * @param records Records to merge
     */
    void upsert(Collection<FileRecord> records);

    /**
     * Stamp the observed paths with the session timestamp and optionally purge
     * every record the session did not observe.
     *
     * @param seenPaths Paths observed by this scan
     * @param purgeUnseen Whether to delete records last seen before this session
     * @return Number of purged records
     */
    int finalizeSession(Collection<String> seenPaths, boolean purgeUnseen);

    @Override
    void close();
}
