package guraa.photoclean.service;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import guraa.photoclean.visual.PerceptualHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds candidate near-duplicate pairs by grouping hashes into buckets on their
 * top bits and comparing only within a bucket (and optionally within nearby
 * buckets). Every reported pair satisfies {@code hamming <= radius}; pairs whose
 * prefixes differ by more than the probe radius are never compared.
 */
@Slf4j
@Component
public class CandidateBucketer {

    static final double PHASH_WEIGHT = 0.7;
    static final double DHASH_WEIGHT = 0.3;

    /**
     * Produce candidates for the configured similarity mode.
     *
     * @param phashes pHash by path, may be empty when the mode does not use it
     * @param dhashes dHash by path, may be empty when the mode does not use it
     * @param options Radii, bucket bits, probe radius and mode
     * @param token Cancellation token, checked between buckets
     * @return Pairs ordered by distance then path
     */
    public List<SimilarityPair> findCandidates(Map<String, Long> phashes, Map<String, Long> dhashes,
                                               ScanOptions options, CancellationToken token) {
        switch (options.getSimilarityMode()) {
            case PHASH:
                return findPairs(phashes, options.getPhashRadius(), options.getBucketBits(),
                        options.getProbeRadius(), token);
            case DHASH:
                return findPairs(dhashes, options.getDhashRadius(), options.getBucketBits(),
                        options.getProbeRadius(), token);
            case HYBRID:
            default:
                List<SimilarityPair> phashPairs = findPairs(phashes, options.getPhashRadius(),
                        options.getBucketBits(), options.getProbeRadius(), token);
                List<SimilarityPair> dhashPairs = findPairs(dhashes, options.getDhashRadius(),
                        options.getBucketBits(), options.getProbeRadius(), token);
                return mergeHybrid(phashPairs, dhashPairs, options.getPhashRadius(), options.getDhashRadius());
        }
    }

    /**
     * Bucketed radius search over one hash population.
     *
     * @param hashes Hash by path
     * @param radius Maximum Hamming distance
     * @param bucketBits Number of leading bits forming the bucket key; 0 puts everything in one bucket
     * @param probeRadius Also compare buckets whose keys differ in up to this many bits
     * @param token Cancellation token; a cancelled search returns the pairs found so far
     * @return Pairs ordered by distance then path
     */
    public List<SimilarityPair> findPairs(Map<String, Long> hashes, int radius, int bucketBits,
                                          int probeRadius, CancellationToken token) {
        if (hashes.size() < 2) {
            return Collections.emptyList();
        }

        // Sorted maps keep the comparison order, and therefore the output, deterministic
        Map<Long, List<Map.Entry<String, Long>>> buckets = new TreeMap<>(Long::compareUnsigned);
        for (Map.Entry<String, Long> entry : new TreeMap<>(hashes).entrySet()) {
            buckets.computeIfAbsent(bucketKey(entry.getValue(), bucketBits), k -> new ArrayList<>()).add(entry);
        }

        List<Long> keys = new ArrayList<>(buckets.keySet());
        List<SimilarityPair> pairs = new ArrayList<>();
        long comparisons = 0;

        for (int i = 0; i < keys.size(); i++) {
            if (token.isCancelled()) {
                log.info("Candidate search cancelled after {} of {} buckets", i, keys.size());
                break;
            }
            List<Map.Entry<String, Long>> bucket = buckets.get(keys.get(i));
            for (int a = 0; a < bucket.size(); a++) {
                for (int b = a + 1; b < bucket.size(); b++) {
                    comparisons++;
                    addIfClose(pairs, bucket.get(a), bucket.get(b), radius);
                }
            }

            if (probeRadius > 0) {
                // Each neighbouring bucket pair is visited once, from the lower key
                for (int j = i + 1; j < keys.size(); j++) {
                    if (Long.bitCount(keys.get(i) ^ keys.get(j)) > probeRadius) {
                        continue;
                    }
                    for (Map.Entry<String, Long> left : bucket) {
                        for (Map.Entry<String, Long> right : buckets.get(keys.get(j))) {
                            comparisons++;
                            addIfClose(pairs, left, right, radius);
                        }
                    }
                }
            }
        }

        pairs.sort(SimilarityPair.BY_DISTANCE);
        log.debug("{} hashes in {} buckets, {} comparisons, {} pairs within radius {}",
                hashes.size(), buckets.size(), comparisons, pairs.size(), radius);
        return pairs;
    }

    /**
     * Union of pHash and dHash candidates with a blended pseudo-distance in 0-100.
     * A distance missing on one side counts as that side's radius.
     *
     * @param phashPairs pHash candidates
     * @param dhashPairs dHash candidates
     * @param phashRadius pHash radius
     * @param dhashRadius dHash radius
     * @return Merged pairs ordered by pseudo-distance then path
     */
    public List<SimilarityPair> mergeHybrid(List<SimilarityPair> phashPairs, List<SimilarityPair> dhashPairs,
                                            int phashRadius, int dhashRadius) {
        Map<String, int[]> distances = new LinkedHashMap<>();
        Map<String, SimilarityPair> byKey = new LinkedHashMap<>();
        for (SimilarityPair pair : phashPairs) {
            byKey.putIfAbsent(pair.key(), pair);
            distances.computeIfAbsent(pair.key(), k -> new int[]{-1, -1})[0] = pair.getDistance();
        }
        for (SimilarityPair pair : dhashPairs) {
            byKey.putIfAbsent(pair.key(), pair);
            distances.computeIfAbsent(pair.key(), k -> new int[]{-1, -1})[1] = pair.getDistance();
        }

        List<SimilarityPair> merged = new ArrayList<>(byKey.size());
        for (Map.Entry<String, SimilarityPair> entry : byKey.entrySet()) {
            int[] d = distances.get(entry.getKey());
            int phashDistance = d[0] >= 0 ? d[0] : phashRadius;
            int dhashDistance = d[1] >= 0 ? d[1] : dhashRadius;
            SimilarityPair pair = entry.getValue();
            merged.add(SimilarityPair.of(pair.getFirst(), pair.getSecond(),
                    hybridDistance(phashDistance, dhashDistance, phashRadius, dhashRadius)));
        }
        merged.sort(SimilarityPair.BY_DISTANCE);
        log.debug("Hybrid merge: {} pHash + {} dHash candidates -> {} pairs",
                phashPairs.size(), dhashPairs.size(), merged.size());
        return merged;
    }

    static int hybridDistance(int phashDistance, int dhashDistance, int phashRadius, int dhashRadius) {
        double score = PHASH_WEIGHT * phashDistance / Math.max(1, phashRadius)
                + DHASH_WEIGHT * dhashDistance / Math.max(1, dhashRadius);
        return (int) Math.round(100.0 * score);
    }

    static long bucketKey(long hash, int bucketBits) {
        if (bucketBits <= 0) {
            return 0L;
        }
        if (bucketBits >= 64) {
            return hash;
        }
        return hash >>> (64 - bucketBits);
    }

    private static void addIfClose(List<SimilarityPair> pairs, Map.Entry<String, Long> a,
                                   Map.Entry<String, Long> b, int radius) {
        int distance = PerceptualHasher.hammingDistance(a.getValue(), b.getValue());
        if (distance <= radius) {
            pairs.add(SimilarityPair.of(a.getKey(), b.getKey(), distance));
        }
    }
}
