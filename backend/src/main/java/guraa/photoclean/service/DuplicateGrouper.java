package guraa.photoclean.service;

import guraa.photoclean.model.DuplicateGroup;
import guraa.photoclean.model.DuplicateRow;
import guraa.photoclean.model.ImageRank;
import guraa.photoclean.model.SimilarityPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns verified pairs into duplicate groups: connected components of the pair
 * graph, each with one keeper chosen by {@link ImageRank#PRIORITY}.
 */
@Slf4j
@Component
public class DuplicateGrouper {

    /**
     * Build groups from pairs.
     *
     * @param pairs Verified pairs
     * @param ranks Rank attributes by path; a missing entry ranks lowest apart from its path
     * @return Groups ordered by keeper path, with ids 1..n in that order
     */
    public List<DuplicateGroup> group(Collection<SimilarityPair> pairs, Map<String, ImageRank> ranks) {
        UnionFind unionFind = new UnionFind();
        for (SimilarityPair pair : pairs) {
            unionFind.union(pair.getFirst(), pair.getSecond());
        }

        Map<String, TreeSet<String>> components = new HashMap<>();
        for (String path : unionFind.members()) {
            components.computeIfAbsent(unionFind.find(path), root -> new TreeSet<>()).add(path);
        }

        // keeper -> sorted candidates
        Map<String, List<String>> byKeeper = new TreeMap<>();
        for (TreeSet<String> members : components.values()) {
            if (members.size() < 2) {
                continue;
            }
            String keeper = members.stream()
                    .map(path -> ranks.getOrDefault(path, new ImageRank(path, 0.0, 0L, 0L, 0L)))
                    .min(ImageRank.PRIORITY)
                    .map(ImageRank::getPath)
                    .orElseThrow(IllegalStateException::new);
            List<String> candidates = new ArrayList<>(members);
            candidates.remove(keeper);
            byKeeper.put(keeper, candidates);
        }

        List<DuplicateGroup> groups = new ArrayList<>(byKeeper.size());
        int id = 1;
        for (Map.Entry<String, List<String>> entry : byKeeper.entrySet()) {
            groups.add(new DuplicateGroup(id++, entry.getKey(), Collections.unmodifiableList(entry.getValue())));
        }
        log.debug("{} pairs formed {} duplicate groups", pairs.size(), groups.size());
        return groups;
    }

    /**
     * Produce one row per candidate. The distance shown is the direct
     * keeper-candidate distance when that pair exists, otherwise the smallest
     * distance of any pair touching the candidate.
     *
     * @param groups Groups as produced by {@link #group}
     * @param pairs The pairs the groups were built from
     * @param blurScores Blur score by path; missing scores show as 0
     * @return Rows ordered by group id, then candidate path
     */
    public List<DuplicateRow> toRows(List<DuplicateGroup> groups, Collection<SimilarityPair> pairs,
                                     Map<String, Double> blurScores) {
        Map<String, Integer> pairDistance = new HashMap<>();
        Map<String, Integer> nearest = new HashMap<>();
        for (SimilarityPair pair : pairs) {
            pairDistance.merge(pair.key(), pair.getDistance(), Math::min);
            nearest.merge(pair.getFirst(), pair.getDistance(), Math::min);
            nearest.merge(pair.getSecond(), pair.getDistance(), Math::min);
        }

        List<DuplicateRow> rows = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            double keepBlur = blurScores.getOrDefault(group.getKeep(), 0.0);
            for (String candidate : group.getCandidates()) {
                Integer distance = pairDistance.get(SimilarityPair.of(group.getKeep(), candidate, 0).key());
                if (distance == null) {
                    distance = nearest.getOrDefault(candidate, 0);
                }
                rows.add(DuplicateRow.builder()
                        .candidate(candidate)
                        .groupId(group.getId())
                        .keepPath(group.getKeep())
                        .distance(distance)
                        .keepBlur(keepBlur)
                        .candidateBlur(blurScores.getOrDefault(candidate, 0.0))
                        .build());
            }
        }
        rows.sort(Comparator.comparingInt(DuplicateRow::getGroupId).thenComparing(DuplicateRow::getCandidate));
        return rows;
    }

    /**
     * Disjoint-set forest over paths with path halving and union by size.
     */
    static class UnionFind {

        private final Map<String, String> parent = new TreeMap<>();
        private final Map<String, Integer> size = new HashMap<>();

        String find(String path) {
            parent.putIfAbsent(path, path);
            size.putIfAbsent(path, 1);
            String current = path;
            while (!parent.get(current).equals(current)) {
                String grandparent = parent.get(parent.get(current));
                parent.put(current, grandparent);
                current = grandparent;
            }
            return current;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                return;
            }
            if (size.get(rootA) < size.get(rootB)) {
                String swap = rootA;
                rootA = rootB;
                rootB = swap;
            }
            parent.put(rootB, rootA);
            size.put(rootA, size.get(rootA) + size.get(rootB));
        }

        Collection<String> members() {
            return new ArrayList<>(parent.keySet());
        }
    }
}
