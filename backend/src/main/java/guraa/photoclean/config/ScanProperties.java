package guraa.photoclean.config;

import guraa.photoclean.model.Aggregation;
import guraa.photoclean.model.BlurSettings;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityMode;
import guraa.photoclean.model.ThresholdPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Scan defaults bound from {@code app.scan.*}. Requests may override most of them per scan.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app.scan")
public class ScanProperties {

    private List<String> includeExtensions = new ArrayList<>(
            List.of(".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tif", ".tiff"));

    private List<String> excludeSubstrings = new ArrayList<>();

    /**
     * When set, a scan of this directory runs once at startup and its rows are logged.
     */
    private String startupRoot;

    private final Blur blur = new Blur();
    private final Similarity similarity = new Similarity();
    private final Refine refine = new Refine();
    private final Extraction extraction = new Extraction();
    private final Cache cache = new Cache();
    private final Tasks tasks = new Tasks();

    /**
     * Build scan options for a root from the configured defaults.
     *
     * @param root The directory to scan
     * @return Options builder, open for per-request overrides
     */
    public ScanOptions.ScanOptionsBuilder toOptions(Path root) {
        return ScanOptions.builder()
                .root(root)
                .includeExtensions(new ArrayList<>(includeExtensions))
                .excludeSubstrings(new ArrayList<>(excludeSubstrings))
                .blurPolicy(ThresholdPolicy.parse(blur.getPolicy()))
                .tenengradGate(blur.isTenengradGate())
                .tenengradPolicy(ThresholdPolicy.parse(blur.getTenengradPolicy()))
                .similarityEnabled(similarity.isEnabled())
                .similarityMode(SimilarityMode.parse(similarity.getMode()))
                .phashRadius(similarity.getPhashRadius())
                .dhashRadius(similarity.getDhashRadius())
                .bucketBits(similarity.getBucketBits())
                .probeRadius(similarity.getProbeRadius())
                .excludeBlurry(similarity.isExcludeBlurry())
                .mutualTopK(refine.getMutualTopK())
                .ssimEnabled(refine.isSsimEnabled())
                .ssimMaxPairs(refine.getSsimMaxPairs())
                .ssimThreshold(refine.getSsimThreshold())
                .ssimSize(refine.getSsimSize())
                .hsvEnabled(refine.isHsvEnabled())
                .hsvMinCorrelation(refine.getHsvMinCorrelation())
                .hsvSize(refine.getHsvSize())
                .workers(extraction.getWorkers() > 0 ? extraction.getWorkers() : ScanOptions.defaultWorkers())
                .inFlightLimit(extraction.getInFlightLimit())
                .batchSize(extraction.getBatchSize())
                .cacheEnabled(cache.isEnabled())
                .cacheFile(Path.of(cache.getFile()))
                .purgeDeleted(cache.isPurgeDeleted());
    }

    /**
     * Blur metric parameters. These shape stored scores and are fixed per application.
     */
    public BlurSettings toBlurSettings() {
        BlurSettings settings = BlurSettings.builder()
                .scales(new ArrayList<>(blur.getScales()))
                .aggregation(Aggregation.parse(blur.getAggregation()))
                .gaussianKernel(blur.getGaussianKernel())
                .maxSide(blur.getMaxSide())
                .build();
        settings.validate();
        return settings;
    }

    @Getter
    @Setter
    public static class Blur {
        private String policy = "fixed:800";
        private boolean tenengradGate = true;
        private String tenengradPolicy = "fixed:800";
        private List<Double> scales = new ArrayList<>(List.of(1.0, 0.5, 0.25));
        private String aggregation = "median";
        private int gaussianKernel = 3;
        private int maxSide = 2000;
    }

    @Getter
    @Setter
    public static class Similarity {
        private boolean enabled = true;
        private String mode = "hybrid";
        private int phashRadius = 8;
        private int dhashRadius = 12;
        private int bucketBits = 12;
        private int probeRadius = 0;
        private boolean excludeBlurry = true;
    }

    @Getter
    @Setter
    public static class Refine {
        private int mutualTopK = 3;
        private boolean ssimEnabled = true;
        private int ssimMaxPairs = 300;
        private double ssimThreshold = 0.88;
        private int ssimSize = 256;
        private boolean hsvEnabled = true;
        private double hsvMinCorrelation = 0.90;
        private int hsvSize = 256;
    }

    @Getter
    @Setter
    public static class Extraction {
        /**
         * Worker threads per scan; 0 picks half the cores, between 1 and 8.
         */
        private int workers = 0;
        private int inFlightLimit = 256;
        private int batchSize = 512;
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private String file = ScanOptions.DEFAULT_CACHE_FILE;
        private boolean purgeDeleted = true;
    }

    @Getter
    @Setter
    public static class Tasks {
        /**
         * Finished scans kept for status and row queries.
         */
        private int retainFinished = 20;
    }
}
