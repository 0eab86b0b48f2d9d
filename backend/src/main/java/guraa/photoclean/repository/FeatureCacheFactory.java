package guraa.photoclean.repository;

import guraa.photoclean.model.BlurSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Opens feature caches. Each scan root has its own cache file, so caches are
 * created per scan rather than as a shared bean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureCacheFactory {

    private final Clock clock;
    private final BlurSettings blurSettings;

    /**
     * Open the cache at the given location.
     *
     * @param file Cache database file
     * @return The opened cache
     * @throws org.springframework.dao.DataAccessException If the file cannot be created or opened
     */
    public FeatureCache open(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new DataAccessResourceFailureException("Cannot create cache directory " + parent, e);
            }
        }
        return new SqliteFeatureCache(file, clock, blurSettings.layout());
    }
}
