package guraa.photoclean.service;

import guraa.photoclean.config.ConcurrencyConfig;
import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.DuplicateGroup;
import guraa.photoclean.model.DuplicateRow;
import guraa.photoclean.model.Feature;
import guraa.photoclean.model.FileRecord;
import guraa.photoclean.model.ImageFeatures;
import guraa.photoclean.model.ImageFile;
import guraa.photoclean.model.ImageRank;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ScanPhase;
import guraa.photoclean.model.ScanProgressListener;
import guraa.photoclean.model.ScanResult;
import guraa.photoclean.model.ScanRow;
import guraa.photoclean.model.SimilarityPair;
import guraa.photoclean.repository.FallbackFeatureCache;
import guraa.photoclean.repository.FeatureCache;
import guraa.photoclean.repository.FeatureCacheFactory;
import guraa.photoclean.repository.NoOpFeatureCache;
import guraa.photoclean.service.refine.RefinementPipeline;
import guraa.photoclean.util.ImageFileScanner;
import guraa.photoclean.util.ImageLoader;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a scan end to end: enumerate, extract features (through the cache),
 * classify blur, find and refine near-duplicate candidates, and group them.
 * <p>
 * Extraction is the only parallel phase. Workers only compute; every cache
 * access and every merge into the scan state happens on the calling thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanOrchestrator {

    private final FeatureExtractor featureExtractor;
    private final FeatureCacheFactory cacheFactory;
    private final BlurClassifier blurClassifier;
    private final CandidateBucketer candidateBucketer;
    private final RefinementPipeline refinementPipeline;
    private final DuplicateGrouper duplicateGrouper;
    private final ScanMemoryManager memoryManager;

    /**
     * Run a scan.
     *
     * @param options Scan options, validated before any file is touched
     * @param listener Progress callback
     * @param token Cancellation token, honoured between files, batches and phases
     * @return The result; on cancellation a result flagged as cancelled with the rows completed so far
     * @throws guraa.photoclean.model.ScanConfigurationException If an option is invalid
     */
    public ScanResult scan(ScanOptions options, ScanProgressListener listener, CancellationToken token) {
        options.validate();
        long startTime = System.currentTimeMillis();
        Path root = options.getRoot().toAbsolutePath().normalize();
        log.info("Starting scan of {}", root);

        ScanResult result = new ScanResult();
        FeatureCache cache = openCache(options, result.getWarnings());
        Set<String> seen = new LinkedHashSet<>();
        boolean completed = false;

        try {
            cache.beginSession();

            // ENUMERATE
            List<ImageFile> files = ImageFileScanner.scan(root, options.getIncludeExtensions(),
                    options.getExcludeSubstrings());
            result.setFilesFound(files.size());
            notify(listener, ScanPhase.ENUMERATE, files.size(), files.size());
            log.info("Found {} image files under {}", files.size(), root);
            if (token.isCancelled()) {
                return cancelled(result);
            }

            // EXTRACT
            Map<String, ImageFeatures> features = extract(files, requiredFeatures(options), options, cache, seen,
                    result, listener, token);
            if (token.isCancelled()) {
                return cancelled(result);
            }

            // THRESHOLD
            notify(listener, ScanPhase.THRESHOLD, 0, 1);
            BlurClassifier.Classification classification = blurClassifier.classify(features, options);
            result.setBlurCutoff(classification.getBlurCutoff());
            result.setTenengradCutoff(classification.getTenengradCutoff());
            result.setStatistics(classification.getStatistics());
            result.getRows().addAll(classification.getRows());
            notify(listener, ScanPhase.THRESHOLD, 1, 1);

            if (options.isSimilarityEnabled()) {
                if (token.isCancelled()) {
                    return cancelled(result);
                }
                findDuplicates(features, classification, files, options, result, listener, token);
                if (token.isCancelled()) {
                    return cancelled(result);
                }
            }

            completed = true;
            notify(listener, ScanPhase.DONE, 1, 1);
            log.info("Scan of {} finished in {} ms: {} files, {} extracted, {} cache hits, {} undecodable, {} rows",
                    root, System.currentTimeMillis() - startTime, result.getFilesFound(), result.getFilesExtracted(),
                    result.getCacheHits(), result.getDecodeFailures(), result.getRows().size());
            return result;
        } finally {
            cache.finalizeSession(seen, completed && options.isPurgeDeleted());
            cache.close();
        }
    }

    private void findDuplicates(Map<String, ImageFeatures> features, BlurClassifier.Classification classification,
                                List<ImageFile> files, ScanOptions options, ScanResult result,
                                ScanProgressListener listener, CancellationToken token) {
        // BUCKET
        Map<String, Long> phashes = new TreeMap<>();
        Map<String, Long> dhashes = new TreeMap<>();
        for (Map.Entry<String, ImageFeatures> entry : features.entrySet()) {
            if (options.isExcludeBlurry() && classification.getBlurryPaths().contains(entry.getKey())) {
                continue;
            }
            ImageFeatures f = entry.getValue();
            if (options.getSimilarityMode().usesPhash() && f.getPhash() != null) {
                phashes.put(entry.getKey(), f.getPhash());
            }
            if (options.getSimilarityMode().usesDhash() && f.getDhash() != null) {
                dhashes.put(entry.getKey(), f.getDhash());
            }
        }
        notify(listener, ScanPhase.BUCKET, 0, 1);
        List<SimilarityPair> candidates = candidateBucketer.findCandidates(phashes, dhashes, options, token);
        notify(listener, ScanPhase.BUCKET, 1, 1);
        log.info("{} candidate pairs ({} mode)", candidates.size(), options.getSimilarityMode());
        if (token.isCancelled()) {
            return;
        }

        // REFINE
        notify(listener, ScanPhase.REFINE, 0, 1);
        List<SimilarityPair> verified = refinementPipeline.refine(candidates, options, token);
        notify(listener, ScanPhase.REFINE, 1, 1);
        if (token.isCancelled()) {
            return;
        }

        // GROUP
        notify(listener, ScanPhase.GROUP, 0, 1);
        Map<String, ImageFile> filesByPath = new HashMap<>();
        files.forEach(file -> filesByPath.put(file.getPath(), file));
        Map<String, Double> blurScores = new HashMap<>();
        Map<String, ImageRank> ranks = new HashMap<>();
        Set<String> members = new TreeSet<>();
        for (SimilarityPair pair : verified) {
            members.add(pair.getFirst());
            members.add(pair.getSecond());
        }
        for (String path : members) {
            ImageFeatures f = features.get(path);
            double blur = f != null && f.getBlurScore() != null ? f.getBlurScore() : 0.0;
            ImageFile file = filesByPath.get(path);
            blurScores.put(path, blur);
            ranks.put(path, new ImageRank(path, blur, ImageLoader.readPixelCount(Path.of(path)),
                    file != null ? file.getSizeBytes() : 0L, file != null ? file.getModifiedTime() : 0L));
        }

        List<DuplicateGroup> groups = duplicateGrouper.group(verified, ranks);
        List<DuplicateRow> rows = duplicateGrouper.toRows(groups, verified, blurScores);
        result.setGroups(groups);
        List<ScanRow> all = result.getRows();
        all.addAll(rows);
        notify(listener, ScanPhase.GROUP, 1, 1);
        log.info("{} duplicate groups with {} candidates", groups.size(), rows.size());
    }

    private Map<String, ImageFeatures> extract(List<ImageFile> files, Set<Feature> wanted, ScanOptions options,
                                               FeatureCache cache, Set<String> seen, ScanResult result,
                                               ScanProgressListener listener, CancellationToken token) {
        Map<String, ImageFeatures> features = new HashMap<>();
        int total = files.size();
        AtomicInteger done = new AtomicInteger();
        Semaphore inFlight = new Semaphore(options.getInFlightLimit());
        ExecutorService executor = ConcurrencyConfig.newExtractionExecutor(options.getWorkers());
        notify(listener, ScanPhase.EXTRACT, 0, total);

        try {
            for (List<ImageFile> batch : memoryManager.partitionList(files, options.getBatchSize())) {
                if (token.isCancelled()) {
                    break;
                }

                List<String> paths = new ArrayList<>(batch.size());
                batch.forEach(file -> paths.add(file.getPath()));
                Map<String, FileRecord> cached = cache.lookup(paths);

                CompletionService<ExtractionResult> completionService = new ExecutorCompletionService<>(executor);
                int submitted = 0;
                for (ImageFile file : batch) {
                    if (token.isCancelled()) {
                        break;
                    }

                    FileRecord record = cached.get(file.getPath());
                    ImageFeatures known = ImageFeatures.empty();
                    Set<Feature> missing = EnumSet.copyOf(wanted);
                    if (record != null && record.isFreshFor(file)) {
                        known = ImageFeatures.fromRecord(record);
                        missing.removeIf(record::has);
                    }

                    if (missing.isEmpty()) {
                        features.put(file.getPath(), known);
                        seen.add(file.getPath());
                        result.setCacheHits(result.getCacheHits() + 1);
                        notify(listener, ScanPhase.EXTRACT, done.incrementAndGet(), total);
                        continue;
                    }

                    try {
                        inFlight.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.info("Interrupted while waiting for an extraction slot, cancelling scan");
                        token.cancel();
                        break;
                    }
                    ImageFeatures partial = known;
                    // Enumerated files count as seen even when their task fails
                    seen.add(file.getPath());
                    completionService.submit(() -> {
                        try {
                            if (token.isCancelled()) {
                                return ExtractionResult.skipped(file);
                            }
                            ImageFeatures extracted;
                            try {
                                extracted = featureExtractor.extract(Path.of(file.getPath()), missing);
                            } catch (RuntimeException e) {
                                log.warn("Feature extraction failed for {}: {}", file.getPath(), e.toString());
                                extracted = ImageFeatures.empty();
                            }
                            notify(listener, ScanPhase.EXTRACT, done.incrementAndGet(), total);
                            return new ExtractionResult(file, partial, extracted, false);
                        } finally {
                            inFlight.release();
                        }
                    });
                    submitted++;
                }

                List<FileRecord> upserts = new ArrayList<>();
                for (int i = 0; i < submitted; i++) {
                    ExtractionResult outcome = awaitNext(completionService, token);
                    if (outcome == null || outcome.isSkipped()) {
                        continue;
                    }
                    String path = outcome.getFile().getPath();
                    if (outcome.getExtracted().isEmpty()) {
                        result.setDecodeFailures(result.getDecodeFailures() + 1);
                        // Fresh cached values still describe the file
                        if (!outcome.getKnown().isEmpty()) {
                            features.put(path, outcome.getKnown());
                        }
                        continue;
                    }
                    result.setFilesExtracted(result.getFilesExtracted() + 1);
                    features.put(path, outcome.getKnown().merge(outcome.getExtracted()));
                    upserts.add(FileRecord.of(outcome.getFile(), outcome.getExtracted()));
                }
                cache.upsert(upserts);
                memoryManager.suggestGarbageCollection();
            }
        } finally {
            executor.shutdownNow();
        }

        log.info("Extraction: {} from cache, {} extracted, {} undecodable",
                result.getCacheHits(), result.getFilesExtracted(), result.getDecodeFailures());
        return features;
    }

    private ExtractionResult awaitNext(CompletionService<ExtractionResult> completionService,
                                       CancellationToken token) {
        try {
            return completionService.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return null;
        } catch (ExecutionException e) {
            // Worker tasks catch extractor failures, so only an error escapes here
            log.warn("Feature extraction task failed: {}", e.getCause() != null ? e.getCause().toString() : e.toString());
            return null;
        }
    }

    static Set<Feature> requiredFeatures(ScanOptions options) {
        Set<Feature> features = EnumSet.of(Feature.BLUR);
        if (options.isTenengradGate()) {
            features.add(Feature.TENENGRAD);
        }
        if (options.isSimilarityEnabled()) {
            if (options.getSimilarityMode().usesPhash()) {
                features.add(Feature.PHASH);
            }
            if (options.getSimilarityMode().usesDhash()) {
                features.add(Feature.DHASH);
            }
        }
        return features;
    }

    private FeatureCache openCache(ScanOptions options, List<String> warnings) {
        if (!options.isCacheEnabled()) {
            return new NoOpFeatureCache();
        }
        Path file = options.resolveCacheFile();
        try {
            return new FallbackFeatureCache(cacheFactory.open(file), warnings::add);
        } catch (DataAccessException e) {
            String message = "Feature cache " + file + " could not be opened, continuing without cache: "
                    + e.getMessage();
            log.warn(message, e);
            warnings.add(message);
            return new NoOpFeatureCache();
        }
    }

    private ScanResult cancelled(ScanResult result) {
        log.info("Scan cancelled after {} files; returning partial result", result.getFilesExtracted() + result.getCacheHits());
        result.setCancelled(true);
        return result;
    }

    private static void notify(ScanProgressListener listener, ScanPhase phase, int current, int total) {
        try {
            listener.onProgress(phase, current, total);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed: {}", e.toString());
        }
    }

    /**
     * Worker output for one file.
     */
    @Value
    static class ExtractionResult {
        ImageFile file;
        ImageFeatures known;
        ImageFeatures extracted;
        boolean skipped;

        static ExtractionResult skipped(ImageFile file) {
            return new ExtractionResult(file, ImageFeatures.empty(), ImageFeatures.empty(), true);
        }
    }
}
