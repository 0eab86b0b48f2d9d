package guraa.photoclean.service;

import guraa.photoclean.model.BlurRow;
import guraa.photoclean.model.BlurStatistics;
import guraa.photoclean.model.ImageFeatures;
import guraa.photoclean.model.ScanOptions;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies the blur cutoffs to a feature population and produces the blur rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlurClassifier {

    private static final int LOWEST_LISTED = 10;

    private final ThresholdSelector thresholdSelector;

    /**
     * Outcome of classifying one population.
     */
    @Value
    @Builder
    public static class Classification {
        double blurCutoff;
        Double tenengradCutoff;
        Set<String> blurryPaths;
        List<BlurRow> rows;
        BlurStatistics statistics;
    }

    /**
     * Classify every file that has a blur score.
     *
     * @param features Features by path
     * @param options Scan options holding the policies
     * @return Cutoffs, flagged paths in row order, rows and statistics
     */
    public Classification classify(Map<String, ImageFeatures> features, ScanOptions options) {
        Map<String, ImageFeatures> sorted = new TreeMap<>();
        features.forEach((path, f) -> {
            if (f.getBlurScore() != null) {
                sorted.put(path, f);
            }
        });

        double[] blurScores = sorted.values().stream().mapToDouble(ImageFeatures::getBlurScore).toArray();
        double blurCutoff = thresholdSelector.select(blurScores, options.getBlurPolicy());

        Double tenengradCutoff = null;
        if (options.isTenengradGate()) {
            double[] tenengradScores = sorted.values().stream()
                    .filter(f -> f.getTenengrad() != null)
                    .mapToDouble(ImageFeatures::getTenengrad)
                    .toArray();
            tenengradCutoff = thresholdSelector.select(tenengradScores, options.getTenengradPolicy());
        }

        List<BlurRow> rows = new ArrayList<>();
        for (Map.Entry<String, ImageFeatures> entry : sorted.entrySet()) {
            ImageFeatures f = entry.getValue();
            if (!(f.getBlurScore() < blurCutoff)) {
                continue;
            }
            if (tenengradCutoff != null && (f.getTenengrad() == null || !(f.getTenengrad() < tenengradCutoff))) {
                continue;
            }
            rows.add(BlurRow.builder()
                    .candidate(entry.getKey())
                    .blurScore(f.getBlurScore())
                    .tenengrad(tenengradCutoff != null ? f.getTenengrad() : null)
                    .build());
        }
        rows.sort(Comparator.comparingDouble(BlurRow::getBlurScore).thenComparing(BlurRow::getCandidate));

        Set<String> blurry = new LinkedHashSet<>();
        rows.forEach(row -> blurry.add(row.getCandidate()));

        log.info("Blur cutoff {} ({}), Tenengrad cutoff {}: {} of {} files flagged",
                String.format("%.2f", blurCutoff), options.getBlurPolicy(),
                tenengradCutoff != null ? String.format("%.2f", tenengradCutoff) : "off",
                rows.size(), blurScores.length);

        return Classification.builder()
                .blurCutoff(blurCutoff)
                .tenengradCutoff(tenengradCutoff)
                .blurryPaths(Collections.unmodifiableSet(blurry))
                .rows(rows)
                .statistics(statistics(sorted))
                .build();
    }

    private BlurStatistics statistics(Map<String, ImageFeatures> population) {
        if (population.isEmpty()) {
            return BlurStatistics.builder().build();
        }
        double[] values = population.values().stream().mapToDouble(ImageFeatures::getBlurScore).sorted().toArray();

        List<BlurStatistics.ScoredPath> lowest = new ArrayList<>();
        population.entrySet().stream()
                .sorted(Comparator.comparingDouble((Map.Entry<String, ImageFeatures> e) -> e.getValue().getBlurScore())
                        .thenComparing(Map.Entry::getKey))
                .limit(LOWEST_LISTED)
                .forEach(e -> lowest.add(new BlurStatistics.ScoredPath(e.getKey(), e.getValue().getBlurScore())));

        return BlurStatistics.builder()
                .count(values.length)
                .mean(ThresholdSelector.mean(values))
                .min(values[0])
                .median(ThresholdSelector.percentile(values, 50))
                .p95(ThresholdSelector.percentile(values, 95))
                .max(values[values.length - 1])
                .lowest(lowest)
                .build();
    }
}
