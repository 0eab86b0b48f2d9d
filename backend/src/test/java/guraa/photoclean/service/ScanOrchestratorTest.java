package guraa.photoclean.service;

import guraa.photoclean.model.BlurRow;
import guraa.photoclean.model.BlurSettings;
import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.DuplicateGroup;
import guraa.photoclean.model.DuplicateRow;
import guraa.photoclean.model.Feature;
import guraa.photoclean.model.FileRecord;
import guraa.photoclean.model.ImageFeatures;
import guraa.photoclean.model.RowKind;
import guraa.photoclean.model.ScanConfigurationException;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ScanPhase;
import guraa.photoclean.model.ScanProgressListener;
import guraa.photoclean.model.ScanResult;
import guraa.photoclean.model.ScanRow;
import guraa.photoclean.model.ThresholdPolicy;
import guraa.photoclean.repository.FeatureCacheFactory;
import guraa.photoclean.repository.SqliteFeatureCache;
import guraa.photoclean.service.refine.HsvHistogramStage;
import guraa.photoclean.service.refine.MutualTopKStage;
import guraa.photoclean.service.refine.RefinementPipeline;
import guraa.photoclean.service.refine.SsimVerificationStage;
import guraa.photoclean.util.TestImages;
import guraa.photoclean.visual.BlurMetrics;
import guraa.photoclean.visual.HsvHistogramComparator;
import guraa.photoclean.visual.PerceptualHasher;
import guraa.photoclean.visual.SSIMCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanOrchestratorTest {

    @TempDir
    Path root;

    private CountingExtractor extractor;
    private ScanOrchestrator orchestrator;
    private String original;
    private String copy;
    private String blurry;

    @BeforeEach
    void setUp() throws IOException {
        original = TestImages.writePng(root.resolve("a.png"), TestImages.cells(1, 128, 128, 8), 2_000L)
                .toAbsolutePath().toString();
        copy = TestImages.writePng(root.resolve("a_copy.png"), TestImages.cells(1, 128, 128, 8), 1_000L)
                .toAbsolutePath().toString();
        TestImages.writePng(root.resolve("b.png"), TestImages.cells(2, 128, 128, 8), 1_000L);
        blurry = TestImages.writePng(root.resolve("blurry.png"), TestImages.gradient(256, 256), 1_000L)
                .toAbsolutePath().toString();
        Files.write(root.resolve("corrupt.jpg"), "not an image at all".repeat(20).getBytes());
        Files.writeString(root.resolve("notes.txt"), "ignored");

        extractor = new CountingExtractor(
                new ImageFeatureExtractor(new BlurMetrics(), new PerceptualHasher(), BlurSettings.defaults()));
        RefinementPipeline pipeline = new RefinementPipeline(List.of(
                new MutualTopKStage(),
                new SsimVerificationStage(new SSIMCalculator()),
                new HsvHistogramStage(new HsvHistogramComparator())));
        FeatureCacheFactory cacheFactory = new FeatureCacheFactory(new TickingClock(10_000L), BlurSettings.defaults());
        orchestrator = new ScanOrchestrator(extractor, cacheFactory,
                new BlurClassifier(new ThresholdSelector()), new CandidateBucketer(), pipeline,
                new DuplicateGrouper(), new ScanMemoryManager());
    }

    @Test
    void findsBlurryImageAndDuplicatePair() {
        ScanResult result = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        assertThat(result.isCancelled()).isFalse();
        assertThat(result.getFilesFound()).isEqualTo(5);
        assertThat(result.getDecodeFailures()).isEqualTo(1);
        assertThat(result.getFilesExtracted()).isEqualTo(4);
        assertThat(result.getWarnings()).isEmpty();

        assertThat(result.countRows(RowKind.BLUR)).isEqualTo(1);
        BlurRow blurRow = (BlurRow) result.getRows().get(0);
        assertThat(Path.of(blurRow.getCandidate()).getFileName().toString()).isEqualTo("blurry.png");
        assertThat(blurRow.getTenengrad()).isNotNull();

        assertThat(result.getGroups()).hasSize(1);
        DuplicateGroup group = result.getGroups().get(0);
        assertThat(group.getKeep()).isEqualTo(original);
        assertThat(group.getCandidates()).containsExactly(copy);

        assertThat(result.countRows(RowKind.DUPLICATE)).isEqualTo(1);
        DuplicateRow duplicateRow = (DuplicateRow) result.getRows().get(1);
        assertThat(duplicateRow.getKeepPath()).isEqualTo(original);
        assertThat(duplicateRow.getCandidate()).isEqualTo(copy);
        assertThat(duplicateRow.getDistance()).isZero();
        assertThat(Files.exists(root.resolve(ScanOptions.DEFAULT_CACHE_FILE))).isTrue();
    }

    @Test
    void secondScanIsServedFromCache() {
        ScanResult first = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());
        int callsAfterFirst = extractor.calls.get();

        ScanResult second = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        // Only the undecodable file is tried again
        assertThat(extractor.calls.get() - callsAfterFirst).isEqualTo(1);
        assertThat(second.getCacheHits()).isEqualTo(4);
        assertThat(second.getFilesExtracted()).isZero();
        assertThat(second.getRows()).isEqualTo(first.getRows());
    }

    @Test
    void changedFileIsExtractedAgain() throws IOException {
        orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());
        TestImages.writePng(root.resolve("b.png"), TestImages.cells(3, 128, 128, 8), 5_000L);
        int callsBefore = extractor.calls.get();

        ScanResult result = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        assertThat(extractor.calls.get() - callsBefore).isEqualTo(2);
        assertThat(result.getCacheHits()).isEqualTo(3);
    }

    @Test
    void disabledCacheWritesNothing() {
        ScanResult result = orchestrator.scan(options().cacheEnabled(false).build(), ScanProgressListener.NONE,
                CancellationToken.none());

        assertThat(result.getFilesExtracted()).isEqualTo(4);
        assertThat(Files.exists(root.resolve(ScanOptions.DEFAULT_CACHE_FILE))).isFalse();
    }

    @Test
    void similarityOffProducesOnlyBlurRows() {
        ScanResult result = orchestrator.scan(options().similarityEnabled(false).build(), ScanProgressListener.NONE,
                CancellationToken.none());

        assertThat(result.getRows()).extracting(ScanRow::getKind).containsOnly(RowKind.BLUR);
        assertThat(extractor.requested).doesNotContain(Feature.PHASH, Feature.DHASH);
    }

    @Test
    void preCancelledTokenReturnsCancelledResult() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        ScanResult result = orchestrator.scan(options().build(), ScanProgressListener.NONE, token);

        assertThat(result.isCancelled()).isTrue();
        assertThat(result.getRows()).isEmpty();
        assertThat(extractor.calls.get()).isZero();
    }

    @Test
    void cancellingDuringExtractionStopsTheScan() {
        CancellationToken token = new CancellationToken();
        ScanProgressListener listener = (phase, current, total) -> {
            if (phase == ScanPhase.EXTRACT) {
                token.cancel();
            }
        };

        ScanResult result = orchestrator.scan(options().build(), listener, token);

        assertThat(result.isCancelled()).isTrue();
        assertThat(result.getGroups()).isEmpty();
    }

    @Test
    void cancelledScanKeepsCompletedRecordsWithoutPurging() {
        Path cacheFile = root.resolve(ScanOptions.DEFAULT_CACHE_FILE);
        String gone = root.resolve("gone.png").toAbsolutePath().toString();
        SqliteFeatureCache seeded = new SqliteFeatureCache(cacheFile,
                Clock.fixed(Instant.ofEpochSecond(1_000L), ZoneOffset.UTC), BlurSettings.defaults().layout());
        try {
            seeded.beginSession();
            seeded.upsert(List.of(FileRecord.builder().path(gone).modifiedTime(1L).sizeBytes(1L).blurScore(5.0).build()));
        } finally {
            seeded.close();
        }

        CancellationToken token = new CancellationToken();
        ScanProgressListener listener = (phase, current, total) -> {
            if (phase == ScanPhase.EXTRACT && current >= 1) {
                token.cancel();
            }
        };
        ScanResult cancelled = orchestrator.scan(options().workers(1).batchSize(1).build(), listener, token);

        assertThat(cancelled.isCancelled()).isTrue();
        assertThat(extractor.calls.get()).isEqualTo(1);
        Map<String, FileRecord> stored = lookup(cacheFile, original, copy, gone);
        assertThat(stored).containsOnlyKeys(original, gone);
        assertThat(stored.get(original).getBlurScore()).isNotNull();
        assertThat(stored.get(original).getPhash()).isNotNull();

        ScanResult resumed = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        assertThat(resumed.isCancelled()).isFalse();
        assertThat(resumed.getCacheHits()).isEqualTo(1);
        assertThat(extractor.calls.get()).isEqualTo(5);
        assertThat(resumed.getGroups()).hasSize(1);
        // A finished scan drops files that are gone
        assertThat(lookup(cacheFile, original, gone)).containsOnlyKeys(original);
    }

    @Test
    void failedReExtractionKeepsCachedValues() {
        orchestrator.scan(options().similarityEnabled(false).build(), ScanProgressListener.NONE,
                CancellationToken.none());
        extractor.failOn.add(blurry);

        ScanResult result = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        assertThat(result.getDecodeFailures()).isEqualTo(2);
        assertThat(result.countRows(RowKind.BLUR)).isEqualTo(1);
        BlurRow blurRow = (BlurRow) result.getRows().get(0);
        assertThat(blurRow.getCandidate()).isEqualTo(blurry);
        assertThat(result.getGroups()).hasSize(1);

        FileRecord record = lookup(root.resolve(ScanOptions.DEFAULT_CACHE_FILE), blurry).get(blurry);
        assertThat(record).isNotNull();
        assertThat(record.getBlurScore()).isNotNull();
        assertThat(record.getPhash()).isNull();
    }

    @Test
    void failingListenerDoesNotAbortScan() {
        ScanProgressListener listener = (phase, current, total) -> {
            throw new IllegalStateException("listener broke");
        };

        ScanResult result = orchestrator.scan(options().build(), listener, CancellationToken.none());

        assertThat(result.isCancelled()).isFalse();
        assertThat(result.getGroups()).hasSize(1);
    }

    @Test
    void invalidOptionsFailBeforeTouchingFiles() {
        ScanOptions options = options().ssimSize(4).build();

        assertThatThrownBy(() -> orchestrator.scan(options, ScanProgressListener.NONE, CancellationToken.none()))
                .isInstanceOf(ScanConfigurationException.class);
        assertThat(Files.exists(root.resolve(ScanOptions.DEFAULT_CACHE_FILE))).isFalse();
        assertThat(extractor.calls.get()).isZero();
    }

    @Test
    void unusableCacheDegradesToUncachedScan() throws IOException {
        Files.write(root.resolve(ScanOptions.DEFAULT_CACHE_FILE), "x".repeat(4096).getBytes());

        ScanResult result = orchestrator.scan(options().build(), ScanProgressListener.NONE, CancellationToken.none());

        assertThat(result.isCancelled()).isFalse();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getGroups()).hasSize(1);
        assertThat(result.countRows(RowKind.BLUR)).isEqualTo(1);
    }

    @Test
    void excludedSubstringHidesFiles() {
        ScanResult result = orchestrator.scan(options().excludeSubstrings(List.of("_copy")).build(),
                ScanProgressListener.NONE, CancellationToken.none());

        assertThat(result.getFilesFound()).isEqualTo(4);
        assertThat(result.getGroups()).isEmpty();
    }

    private ScanOptions.ScanOptionsBuilder options() {
        return ScanOptions.builder()
                .root(root)
                .blurPolicy(ThresholdPolicy.fixed(100.0))
                .tenengradPolicy(ThresholdPolicy.fixed(100.0))
                .workers(2);
    }

    private static Map<String, FileRecord> lookup(Path cacheFile, String... paths) {
        SqliteFeatureCache cache = new SqliteFeatureCache(cacheFile, Clock.systemUTC(), BlurSettings.defaults().layout());
        try {
            return cache.lookup(List.of(paths));
        } finally {
            cache.close();
        }
    }

    /**
     * Clock that moves one second forward on every read, so each scan gets its own session stamp.
     */
    static class TickingClock extends Clock {

        private final AtomicLong seconds;

        TickingClock(long startSeconds) {
            this.seconds = new AtomicLong(startSeconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochSecond(seconds.getAndIncrement());
        }
    }

    /**
     * Delegating extractor that records how often it ran.
     */
    static class CountingExtractor implements FeatureExtractor {

        final AtomicInteger calls = new AtomicInteger();
        final Set<Feature> requested = Collections.synchronizedSet(EnumSet.noneOf(Feature.class));
        final Set<String> failOn = ConcurrentHashMap.newKeySet();
        private final FeatureExtractor delegate;

        CountingExtractor(FeatureExtractor delegate) {
            this.delegate = delegate;
        }

        @Override
        public ImageFeatures extract(Path path, Set<Feature> features) {
            calls.incrementAndGet();
            requested.addAll(features);
            if (failOn.contains(path.toString())) {
                throw new IllegalStateException("extractor broke on " + path);
            }
            return delegate.extract(path, features);
        }
    }
}
