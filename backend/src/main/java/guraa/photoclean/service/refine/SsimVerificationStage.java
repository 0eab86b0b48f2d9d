package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import guraa.photoclean.util.GrayImage;
import guraa.photoclean.util.ImageLoader;
import guraa.photoclean.util.LruCache;
import guraa.photoclean.visual.SSIMCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural check of the closest pairs. Only the first N pairs by distance are
 * verified; pairs beyond that cap are dropped, as are pairs where either image
 * fails to decode.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class SsimVerificationStage implements RefinementStage {

    // Reduced images kept around while walking the pair list
    private static final int THUMBNAIL_CACHE_SIZE = 64;

    private final SSIMCalculator ssimCalculator;

    @Override
    public String getName() {
        return "ssim";
    }

    @Override
    public boolean isEnabled(ScanOptions options) {
        return options.isSsimEnabled();
    }

    @Override
    public List<SimilarityPair> apply(List<SimilarityPair> pairs, ScanOptions options, CancellationToken token) {
        int limit = Math.min(pairs.size(), options.getSsimMaxPairs());
        if (pairs.size() > limit) {
            log.info("SSIM verifies the closest {} of {} pairs; the rest are dropped", limit, pairs.size());
        }

        int size = options.getSsimSize();
        Map<String, Optional<GrayImage>> thumbnails = new LruCache<>(THUMBNAIL_CACHE_SIZE);

        List<SimilarityPair> kept = new ArrayList<>();
        int undecodable = 0;
        for (int i = 0; i < limit; i++) {
            if (token.isCancelled()) {
                break;
            }
            SimilarityPair pair = pairs.get(i);
            Optional<GrayImage> first = thumbnails.computeIfAbsent(pair.getFirst(), p -> load(p, size));
            Optional<GrayImage> second = thumbnails.computeIfAbsent(pair.getSecond(), p -> load(p, size));
            if (!first.isPresent() || !second.isPresent()) {
                undecodable++;
                continue;
            }

            double ssim = ssimCalculator.calculate(first.get(), second.get());
            if (ssim >= options.getSsimThreshold()) {
                kept.add(pair);
            } else {
                log.debug("SSIM {} below {} for {} / {}", ssim, options.getSsimThreshold(),
                        pair.getFirst(), pair.getSecond());
            }
        }
        if (undecodable > 0) {
            log.warn("{} pairs dropped from SSIM verification because an image could not be decoded", undecodable);
        }
        return kept;
    }

    private static Optional<GrayImage> load(String path, int size) {
        GrayImage gray = ImageLoader.readGray(Path.of(path));
        return gray == null ? Optional.empty() : Optional.of(gray.resizeArea(size, size));
    }
}
