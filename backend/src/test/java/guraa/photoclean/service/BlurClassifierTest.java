package guraa.photoclean.service;

import guraa.photoclean.model.BlurRow;
import guraa.photoclean.model.ImageFeatures;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ThresholdPolicy;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class BlurClassifierTest {

    private final BlurClassifier classifier = new BlurClassifier(new ThresholdSelector());

    @Test
    void flagsScoresBelowPercentileCutoff() {
        Map<String, ImageFeatures> features = new HashMap<>();
        features.put("/p/a.jpg", blur(50));
        features.put("/p/b.jpg", blur(80));
        features.put("/p/c.jpg", blur(95));
        features.put("/p/d.jpg", blur(400));
        features.put("/p/e.jpg", blur(900));
        ScanOptions options = ScanOptions.builder()
                .blurPolicy(ThresholdPolicy.percentile(20))
                .tenengradGate(false)
                .build();

        BlurClassifier.Classification result = classifier.classify(features, options);

        assertThat(result.getBlurryPaths()).containsExactly("/p/a.jpg");
        assertThat(result.getTenengradCutoff()).isNull();
        assertThat(result.getRows().get(0).getRelation()).isEqualTo("blur_value=50.000000");
        assertThat(result.getStatistics().getCount()).isEqualTo(5);
        assertThat(result.getStatistics().getMedian()).isEqualTo(95.0);
        assertThat(result.getStatistics().getLowest().get(0).getPath()).isEqualTo("/p/a.jpg");
    }

    @Test
    void tenengradGateRequiresBothMeasuresBelowCutoff() {
        Map<String, ImageFeatures> features = new HashMap<>();
        features.put("/p/soft.jpg", ImageFeatures.builder().blurScore(10.0).tenengrad(5.0).build());
        features.put("/p/textured.jpg", ImageFeatures.builder().blurScore(10.0).tenengrad(5000.0).build());
        features.put("/p/sharp.jpg", ImageFeatures.builder().blurScore(2000.0).tenengrad(5.0).build());
        ScanOptions options = ScanOptions.builder()
                .blurPolicy(ThresholdPolicy.fixed(100))
                .tenengradGate(true)
                .tenengradPolicy(ThresholdPolicy.fixed(100))
                .build();

        BlurClassifier.Classification result = classifier.classify(features, options);

        assertThat(result.getBlurryPaths()).containsExactly("/p/soft.jpg");
        assertThat(result.getRows().get(0).getRelation()).isEqualTo("blur_value=10.000000; tenengrad=5.000000");
    }

    @Test
    void rowsAreOrderedByScoreThenPath() {
        Map<String, ImageFeatures> features = new HashMap<>();
        features.put("/p/z.jpg", blur(5));
        features.put("/p/b.jpg", blur(5));
        features.put("/p/a.jpg", blur(7));
        ScanOptions options = ScanOptions.builder().blurPolicy(ThresholdPolicy.fixed(10)).tenengradGate(false).build();

        BlurClassifier.Classification result = classifier.classify(features, options);

        assertThat(result.getRows().stream().map(BlurRow::getCandidate).collect(Collectors.toList()))
                .containsExactly("/p/b.jpg", "/p/z.jpg", "/p/a.jpg");
    }

    @Test
    void filesWithoutScoreAreIgnored() {
        Map<String, ImageFeatures> features = new HashMap<>();
        features.put("/p/hash-only.jpg", ImageFeatures.builder().phash(1L).build());
        ScanOptions options = ScanOptions.builder().blurPolicy(ThresholdPolicy.percentile(50)).tenengradGate(false).build();

        BlurClassifier.Classification result = classifier.classify(features, options);

        assertThat(result.getBlurCutoff()).isZero();
        assertThat(result.getRows()).isEmpty();
        assertThat(result.getStatistics().getCount()).isZero();
    }

    private static ImageFeatures blur(double score) {
        return ImageFeatures.builder().blurScore(score).build();
    }
}
