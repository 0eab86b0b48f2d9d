package guraa.photoclean.service;

import guraa.photoclean.model.Feature;
import guraa.photoclean.model.ImageFeatures;

import java.nio.file.Path;
import java.util.Set;

/**
 * Computes per-image features. Implementations are stateless and safe to call
 * from several threads at once.
 */
public interface FeatureExtractor {

    /**
     * Decode the image once and compute the requested features.
     *
     * @param path The image file
     * @param features Features to compute
     * @return The requested values; {@link ImageFeatures#empty()} when the file cannot be decoded.
     *         Never throws for unreadable or corrupt input.
     */
    ImageFeatures extract(Path path, Set<Feature> features);
}
