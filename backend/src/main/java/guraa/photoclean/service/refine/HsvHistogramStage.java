package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import guraa.photoclean.util.ImageLoader;
import guraa.photoclean.util.LruCache;
import guraa.photoclean.visual.HsvHistogramComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Colour check: keeps pairs whose hue/saturation histograms correlate at
 * least at the configured level.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class HsvHistogramStage implements RefinementStage {

    // Histograms kept around while walking the pair list
    static final int HISTOGRAM_CACHE_SIZE = 64;

    private final HsvHistogramComparator comparator;

    @Override
    public String getName() {
        return "hsv-histogram";
    }

    @Override
    public boolean isEnabled(ScanOptions options) {
        return options.isHsvEnabled();
    }

    @Override
    public List<SimilarityPair> apply(List<SimilarityPair> pairs, ScanOptions options, CancellationToken token) {
        int size = options.getHsvSize();
        Map<String, Optional<double[]>> histograms = new LruCache<>(HISTOGRAM_CACHE_SIZE);

        List<SimilarityPair> kept = new ArrayList<>();
        for (SimilarityPair pair : pairs) {
            if (token.isCancelled()) {
                break;
            }
            Optional<double[]> first = histograms.computeIfAbsent(pair.getFirst(), p -> histogram(p, size));
            Optional<double[]> second = histograms.computeIfAbsent(pair.getSecond(), p -> histogram(p, size));
            if (!first.isPresent() || !second.isPresent()) {
                continue;
            }

            double correlation = comparator.correlation(first.get(), second.get());
            if (correlation >= options.getHsvMinCorrelation()) {
                kept.add(pair);
            } else {
                log.debug("HSV correlation {} below {} for {} / {}", correlation, options.getHsvMinCorrelation(),
                        pair.getFirst(), pair.getSecond());
            }
        }
        return kept;
    }

    private Optional<double[]> histogram(String path, int size) {
        BufferedImage image = ImageLoader.read(Path.of(path));
        if (image == null) {
            return Optional.empty();
        }
        return Optional.of(comparator.histogram(ImageLoader.resize(image, size, size)));
    }
}
