package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the enabled refinement stages in order. With every stage disabled the
 * input is returned unchanged.
 */
@Slf4j
@Service
public class RefinementPipeline {

    private final List<RefinementStage> stages;

    /**
     * @param stages Stages in execution order
     */
    public RefinementPipeline(List<RefinementStage> stages) {
        this.stages = new ArrayList<>(stages);
    }

    public List<SimilarityPair> refine(List<SimilarityPair> pairs, ScanOptions options, CancellationToken token) {
        List<SimilarityPair> current = pairs;
        for (RefinementStage stage : stages) {
            if (token.isCancelled()) {
                break;
            }
            if (!stage.isEnabled(options) || current.isEmpty()) {
                continue;
            }
            long start = System.currentTimeMillis();
            int before = current.size();
            current = stage.apply(current, options, token);
            log.info("Refinement stage {}: {} -> {} pairs in {} ms", stage.getName(), before, current.size(),
                    System.currentTimeMillis() - start);
        }
        return current;
    }
}
