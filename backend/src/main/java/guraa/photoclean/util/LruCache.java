package guraa.photoclean.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access-ordered map holding at most a fixed number of entries; the least
 * recently used entry is evicted first. Not thread-safe.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public class LruCache<K, V> extends LinkedHashMap<K, V> {

    private static final long serialVersionUID = 1L;

    private final int maxEntries;

    public LruCache(int maxEntries) {
        super(16, 0.75f, true);
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        return size() > maxEntries;
    }
}
