package guraa.photoclean.controller;

import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityMode;
import guraa.photoclean.model.ThresholdPolicy;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of a scan submission. Only {@code root} is required; every other field
 * overrides the configured default when present.
 */
@Data
public class ScanRequest {

    private String root;
    private List<String> includeExtensions;
    private List<String> excludeSubstrings;

    private String blurPolicy;
    private Boolean tenengradGate;
    private String tenengradPolicy;

    private Boolean similarity;
    private String similarityMode;
    private Integer phashRadius;
    private Integer dhashRadius;
    private Integer bucketBits;
    private Integer probeRadius;
    private Boolean excludeBlurry;

    private Integer mutualTopK;
    private Boolean ssim;
    private Integer ssimMaxPairs;
    private Double ssimThreshold;
    private Boolean hsv;
    private Double hsvMinCorrelation;

    private Integer workers;
    private Boolean useCache;
    private String cacheFile;
    private Boolean purgeDeleted;

    /**
     * Apply the fields that are set on top of a defaults builder.
     *
     * @param builder Builder holding the configured defaults
     * @return The same builder
     * @throws guraa.photoclean.model.ScanConfigurationException If a policy or mode string is invalid
     */
    public ScanOptions.ScanOptionsBuilder applyTo(ScanOptions.ScanOptionsBuilder builder) {
        if (includeExtensions != null) {
            builder.includeExtensions(new ArrayList<>(includeExtensions));
        }
        if (excludeSubstrings != null) {
            builder.excludeSubstrings(new ArrayList<>(excludeSubstrings));
        }
        if (blurPolicy != null) {
            builder.blurPolicy(ThresholdPolicy.parse(blurPolicy));
        }
        if (tenengradGate != null) {
            builder.tenengradGate(tenengradGate);
        }
        if (tenengradPolicy != null) {
            builder.tenengradPolicy(ThresholdPolicy.parse(tenengradPolicy));
        }
        if (similarity != null) {
            builder.similarityEnabled(similarity);
        }
        if (similarityMode != null) {
            builder.similarityMode(SimilarityMode.parse(similarityMode));
        }
        if (phashRadius != null) {
            builder.phashRadius(phashRadius);
        }
        if (dhashRadius != null) {
            builder.dhashRadius(dhashRadius);
        }
        if (bucketBits != null) {
            builder.bucketBits(bucketBits);
        }
        if (probeRadius != null) {
            builder.probeRadius(probeRadius);
        }
        if (excludeBlurry != null) {
            builder.excludeBlurry(excludeBlurry);
        }
        if (mutualTopK != null) {
            builder.mutualTopK(mutualTopK);
        }
        if (ssim != null) {
            builder.ssimEnabled(ssim);
        }
        if (ssimMaxPairs != null) {
            builder.ssimMaxPairs(ssimMaxPairs);
        }
        if (ssimThreshold != null) {
            builder.ssimThreshold(ssimThreshold);
        }
        if (hsv != null) {
            builder.hsvEnabled(hsv);
        }
        if (hsvMinCorrelation != null) {
            builder.hsvMinCorrelation(hsvMinCorrelation);
        }
        if (workers != null) {
            builder.workers(workers);
        }
        if (useCache != null) {
            builder.cacheEnabled(useCache);
        }
        if (cacheFile != null) {
            builder.cacheFile(Path.of(cacheFile));
        }
        if (purgeDeleted != null) {
            builder.purgeDeleted(purgeDeleted);
        }
        return builder;
    }
}
