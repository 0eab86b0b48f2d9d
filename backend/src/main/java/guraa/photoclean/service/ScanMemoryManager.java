package guraa.photoclean.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps extraction memory bounded: work is split into batches, and between
 * batches the JVM is nudged to collect when the heap runs full.
 */
@Slf4j
@Component
public class ScanMemoryManager {

    // Memory threshold for garbage collection (80%)
    private static final double MEMORY_THRESHOLD = 0.8;

    /**
     * Split a list into consecutive views of at most {@code size} elements.
     *
     * @param list The list to split
     * @param size The batch size
     * @return The batches, empty for an empty list
     */
    public <T> List<List<T>> partitionList(List<T> list, int size) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }

        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            result.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return result;
    }

    /**
     * Request a collection when heap usage is above the threshold.
     */
    public void suggestGarbageCollection() {
        long maxMemory = Runtime.getRuntime().maxMemory();
        long usedMemory = Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();
        double memoryUsageRatio = (double) usedMemory / maxMemory;

        if (memoryUsageRatio > MEMORY_THRESHOLD) {
            log.info("High memory usage detected ({}%), suggesting garbage collection",
                    (int) (memoryUsageRatio * 100));
            System.gc();
        }
    }
}
