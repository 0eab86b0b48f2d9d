package guraa.photoclean.service;

import guraa.photoclean.model.BlurSettings;
import guraa.photoclean.model.Feature;
import guraa.photoclean.model.ImageFeatures;
import guraa.photoclean.util.GrayImage;
import guraa.photoclean.util.ImageLoader;
import guraa.photoclean.visual.BlurMetrics;
import guraa.photoclean.visual.PerceptualHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Set;

/**
 * Feature extractor backed by ImageIO decoding.
 */
@Slf4j
@Component
public class ImageFeatureExtractor implements FeatureExtractor {

    private final BlurMetrics blurMetrics;
    private final PerceptualHasher hasher;
    private final BlurSettings settings;

    public ImageFeatureExtractor(BlurMetrics blurMetrics, PerceptualHasher hasher, BlurSettings settings) {
        settings.validate();
        this.blurMetrics = blurMetrics;
        this.hasher = hasher;
        this.settings = settings;
    }

    @Override
    public ImageFeatures extract(Path path, Set<Feature> features) {
        if (features.isEmpty()) {
            return ImageFeatures.empty();
        }

        BufferedImage image = ImageLoader.read(path);
        if (image == null) {
            return ImageFeatures.empty();
        }

        try {
            GrayImage limited = GrayImage.fromImage(image).limitLongSide(settings.getMaxSide());

            ImageFeatures.ImageFeaturesBuilder result = ImageFeatures.builder();
            if (features.contains(Feature.BLUR) || features.contains(Feature.TENENGRAD)) {
                GrayImage smoothed = blurMetrics.gaussianBlur(limited, settings.getGaussianKernel());
                if (features.contains(Feature.BLUR)) {
                    result.blurScore(blurMetrics.multiScaleLaplacianVariance(smoothed, settings));
                }
                if (features.contains(Feature.TENENGRAD)) {
                    result.tenengrad(blurMetrics.tenengrad(smoothed));
                }
            }
            if (features.contains(Feature.PHASH)) {
                result.phash(hasher.phash(limited));
            }
            if (features.contains(Feature.DHASH)) {
                result.dhash(hasher.dhash(limited));
            }
            return result.build();
        } catch (RuntimeException e) {
            log.warn("Feature extraction failed for {}: {}", path, e.toString());
            return ImageFeatures.empty();
        }
    }
}
