package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one scan needs to know. Built from the application properties
 * and optionally overridden per request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScanOptions {

    public static final String DEFAULT_CACHE_FILE = ".photo_clean_cache.sqlite";

    private Path root;

    @Builder.Default
    private List<String> includeExtensions = new ArrayList<>(
            List.of(".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tif", ".tiff"));

    @Builder.Default
    private List<String> excludeSubstrings = new ArrayList<>();

    // Blur classification
    @Builder.Default
    private ThresholdPolicy blurPolicy = ThresholdPolicy.fixed(800.0);

    @Builder.Default
    private boolean tenengradGate = true;

    @Builder.Default
    private ThresholdPolicy tenengradPolicy = ThresholdPolicy.fixed(800.0);

    // Near-duplicate search
    @Builder.Default
    private boolean similarityEnabled = true;

    @Builder.Default
    private SimilarityMode similarityMode = SimilarityMode.HYBRID;

    @Builder.Default
    private int phashRadius = 8;

    @Builder.Default
    private int dhashRadius = 12;

    @Builder.Default
    private int bucketBits = 12;

    @Builder.Default
    private int probeRadius = 0;

    @Builder.Default
    private boolean excludeBlurry = true;

    // Refinement
    @Builder.Default
    private int mutualTopK = 3;

    @Builder.Default
    private boolean ssimEnabled = true;

    @Builder.Default
    private int ssimMaxPairs = 300;

    @Builder.Default
    private double ssimThreshold = 0.88;

    @Builder.Default
    private int ssimSize = 256;

    @Builder.Default
    private boolean hsvEnabled = true;

    @Builder.Default
    private double hsvMinCorrelation = 0.90;

    @Builder.Default
    private int hsvSize = 256;

    // Cache
    @Builder.Default
    private boolean cacheEnabled = true;

    /**
     * Cache database file; a relative path resolves against the root.
     */
    @Builder.Default
    private Path cacheFile = Path.of(DEFAULT_CACHE_FILE);

    @Builder.Default
    private boolean purgeDeleted = true;

    // Extraction
    @Builder.Default
    private int workers = defaultWorkers();

    @Builder.Default
    private int inFlightLimit = 256;

    @Builder.Default
    private int batchSize = 512;

    /**
     * Roughly half the cores, at least one and at most eight.
     */
    public static int defaultWorkers() {
        return Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors() / 2));
    }

    /**
     * Resolve the cache file location against the scan root.
     *
     * @return Absolute cache file path
     */
    public Path resolveCacheFile() {
        Path file = cacheFile != null ? cacheFile : Path.of(DEFAULT_CACHE_FILE);
        return file.isAbsolute() ? file : root.resolve(file).toAbsolutePath().normalize();
    }

    /**
     * Check every option. Must run before any file is enumerated.
     *
     * @throws ScanConfigurationException On the first invalid option
     */
    public void validate() {
        if (root == null) {
            throw new ScanConfigurationException("Scan root is missing");
        }
        if (!Files.isDirectory(root)) {
            throw new ScanConfigurationException("Scan root is not a directory: " + root);
        }
        if (blurPolicy == null) {
            throw new ScanConfigurationException("Blur threshold policy is missing");
        }
        if (tenengradGate && tenengradPolicy == null) {
            throw new ScanConfigurationException("Tenengrad threshold policy is missing");
        }
        if (similarityMode == null) {
            throw new ScanConfigurationException("Similarity mode is missing");
        }
        checkRange("phash radius", phashRadius, 0, 64);
        checkRange("dhash radius", dhashRadius, 0, 64);
        checkRange("bucket bits", bucketBits, 0, 64);
        checkRange("probe radius", probeRadius, 0, 3);
        checkRange("mutual top-k", mutualTopK, 0, Integer.MAX_VALUE);
        checkRange("ssim max pairs", ssimMaxPairs, 0, Integer.MAX_VALUE);
        checkRange("ssim size", ssimSize, 8, 4096);
        checkRange("hsv size", hsvSize, 1, 4096);
        checkRange("workers", workers, 1, 64);
        checkRange("in-flight limit", inFlightLimit, 1, Integer.MAX_VALUE);
        checkRange("batch size", batchSize, 1, Integer.MAX_VALUE);
        if (ssimThreshold < -1.0 || ssimThreshold > 1.0) {
            throw new ScanConfigurationException("SSIM threshold must be within [-1, 1]: " + ssimThreshold);
        }
        if (hsvMinCorrelation < -1.0 || hsvMinCorrelation > 1.0) {
            throw new ScanConfigurationException("HSV correlation must be within [-1, 1]: " + hsvMinCorrelation);
        }
        if (includeExtensions == null || includeExtensions.isEmpty()) {
            throw new ScanConfigurationException("At least one image extension is required");
        }
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ScanConfigurationException(
                    String.format("%s must be within [%d, %d]: %d", name, min, max, value));
        }
    }
}
