package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps a pair only if each member is among the other's K nearest neighbours
 * in the candidate graph. Neighbours are ranked by distance, then path.
 */
@Component
@Order(1)
public class MutualTopKStage implements RefinementStage {

    @Override
    public String getName() {
        return "mutual-top-k";
    }

    @Override
    public boolean isEnabled(ScanOptions options) {
        return options.getMutualTopK() > 0;
    }

    @Override
    public List<SimilarityPair> apply(List<SimilarityPair> pairs, ScanOptions options, CancellationToken token) {
        int k = options.getMutualTopK();

        Map<String, List<SimilarityPair>> incident = new HashMap<>();
        for (SimilarityPair pair : pairs) {
            incident.computeIfAbsent(pair.getFirst(), p -> new ArrayList<>()).add(pair);
            incident.computeIfAbsent(pair.getSecond(), p -> new ArrayList<>()).add(pair);
        }

        Map<String, Set<String>> nearest = new HashMap<>();
        for (Map.Entry<String, List<SimilarityPair>> entry : incident.entrySet()) {
            String path = entry.getKey();
            Set<String> top = new HashSet<>();
            entry.getValue().stream()
                    .sorted(Comparator.comparingInt(SimilarityPair::getDistance)
                            .thenComparing(pair -> pair.other(path)))
                    .limit(k)
                    .forEach(pair -> top.add(pair.other(path)));
            nearest.put(path, top);
        }

        List<SimilarityPair> kept = new ArrayList<>();
        for (SimilarityPair pair : pairs) {
            if (nearest.get(pair.getFirst()).contains(pair.getSecond())
                    && nearest.get(pair.getSecond()).contains(pair.getFirst())) {
                kept.add(pair);
            }
        }
        return kept;
    }
}
